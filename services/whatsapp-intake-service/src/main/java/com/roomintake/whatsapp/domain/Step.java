package com.roomintake.whatsapp.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Position of a party in the fixed intake graph.
 *
 * <p>Codes are persisted with the session, so renaming a constant is fine but changing a code is
 * a schema change: records holding a code this enum no longer knows are read back as a fresh
 * {@link #START}.
 */
public enum Step {
  START("start", null),
  AWAITING_IMAGE("awaiting_image", null),
  COLLECTING_HOUSE_TYPE("collecting_house_type", null),
  ASKING_CAT("asking_cat", null),
  ASKING_AVAILABILITY("asking_availability", null),
  SINGLE_COUNT("single_count", RoomTier.SINGLE),
  SINGLE_RENT("single_rent", RoomTier.SINGLE),
  TWO_SHARE_COUNT("two_share_count", RoomTier.TWO_SHARE),
  TWO_SHARE_RENT("two_share_rent", RoomTier.TWO_SHARE),
  THREE_SHARE_COUNT("three_share_count", RoomTier.THREE_SHARE),
  THREE_SHARE_RENT("three_share_rent", RoomTier.THREE_SHARE),
  ASKING_AGE("asking_age", null),
  CONFIRMING_LISTING("confirming_listing", null),
  STUDENT_PENDING("student_pending", null),
  END("end", null);

  private final String code;
  private final RoomTier tier;

  Step(String code, RoomTier tier) {
    this.code = code;
    this.tier = tier;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Room tier for the count/rent sub-states, null elsewhere. */
  public RoomTier tier() {
    return tier;
  }

  public static Step countOf(RoomTier tier) {
    return switch (tier) {
      case SINGLE -> SINGLE_COUNT;
      case TWO_SHARE -> TWO_SHARE_COUNT;
      case THREE_SHARE -> THREE_SHARE_COUNT;
    };
  }

  public static Step rentOf(RoomTier tier) {
    return switch (tier) {
      case SINGLE -> SINGLE_RENT;
      case TWO_SHARE -> TWO_SHARE_RENT;
      case THREE_SHARE -> THREE_SHARE_RENT;
    };
  }

  /**
   * @return the step for a persisted code, or null when the code is unknown
   */
  @JsonCreator
  public static Step fromCode(String code) {
    if (code == null) {
      return null;
    }
    String c = code.trim().toLowerCase(Locale.ROOT);
    for (Step s : values()) {
      if (s.code.equals(c)) {
        return s;
      }
    }
    return null;
  }
}
