package com.roomintake.whatsapp.domain;

import java.math.BigDecimal;

/** Room pricing tiers collected in order: single, two-share, three-share. */
public enum RoomTier {
  SINGLE("single"),
  TWO_SHARE("2-sharing"),
  THREE_SHARE("3-sharing");

  private final String label;

  RoomTier(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Tier asked after this one, or null when the last tier is done. */
  public RoomTier next() {
    return switch (this) {
      case SINGLE -> TWO_SHARE;
      case TWO_SHARE -> THREE_SHARE;
      case THREE_SHARE -> null;
    };
  }

  public ListingAttributes writeCount(ListingAttributes attributes, int count) {
    return switch (this) {
      case SINGLE -> attributes.withRoomSingleCount(count);
      case TWO_SHARE -> attributes.withRoom2Count(count);
      case THREE_SHARE -> attributes.withRoom3Count(count);
    };
  }

  public ListingAttributes writeRent(ListingAttributes attributes, BigDecimal rent) {
    return switch (this) {
      case SINGLE -> attributes.withRentSingle(rent);
      case TWO_SHARE -> attributes.withRent2(rent);
      case THREE_SHARE -> attributes.withRent3(rent);
    };
  }
}
