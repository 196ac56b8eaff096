package com.roomintake.whatsapp.render;

import com.roomintake.whatsapp.domain.ListingAttributes;
import com.roomintake.whatsapp.domain.RoomTier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Plain-text summary of collected answers; unset answers are left out. */
@Component
public class ListingSummaryFormatter {

  public String format(ListingAttributes a) {
    if (a == null) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    if (a.houseType() != null) {
      lines.add("House type: " + capitalize(a.houseType()));
    }
    if (a.hasCat() != null) {
      lines.add("Cat: " + (a.hasCat() ? "Yes" : "No"));
    }
    for (RoomTier tier : RoomTier.values()) {
      Integer count = a.countFor(tier);
      BigDecimal rent = a.rentFor(tier);
      if (count == null && rent == null) {
        continue;
      }
      StringBuilder sb = new StringBuilder(capitalize(tier.label())).append(" rooms: ");
      sb.append(count == null ? "-" : count);
      if (rent != null) {
        sb.append(" @ ").append(rent.toPlainString());
      }
      lines.add(sb.toString());
    }
    if (a.studentAge() != null) {
      lines.add("Student age: " + a.studentAge());
    }
    return String.join("\n", lines);
  }

  private static String capitalize(String s) {
    if (s == null || s.isEmpty()) {
      return s;
    }
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
