package com.roomintake.whatsapp.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import lombok.With;

/** Answers collected from a landlord; each one is null until its step writes it. */
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListingAttributes(
    String houseType,
    Boolean hasCat,
    Integer roomSingleCount,
    BigDecimal rentSingle,
    Integer room2Count,
    BigDecimal rent2,
    Integer room3Count,
    BigDecimal rent3,
    String studentAge) {

  private static final ListingAttributes EMPTY =
      new ListingAttributes(null, null, null, null, null, null, null, null, null);

  public static ListingAttributes empty() {
    return EMPTY;
  }

  public Integer countFor(RoomTier tier) {
    return switch (tier) {
      case SINGLE -> roomSingleCount;
      case TWO_SHARE -> room2Count;
      case THREE_SHARE -> room3Count;
    };
  }

  public BigDecimal rentFor(RoomTier tier) {
    return switch (tier) {
      case SINGLE -> rentSingle;
      case TWO_SHARE -> rent2;
      case THREE_SHARE -> rent3;
    };
  }
}
