package com.roomintake.whatsapp.domain;

import lombok.With;

/**
 * Per-party conversation record. Stored as a whole on every commit; the store never merges
 * fields.
 */
@With
public record Session(
    String partyId,
    Step step,
    String displayName,
    boolean verified,
    boolean imageReceived,
    ListingAttributes attributes) {

  public Session {
    if (attributes == null) {
      attributes = ListingAttributes.empty();
    }
  }

  public static Session fresh(String partyId) {
    return new Session(partyId, Step.START, null, false, false, ListingAttributes.empty());
  }

  /** Fresh record for the same party; keeps only the captured display name. */
  public Session restart() {
    return new Session(partyId, Step.START, displayName, false, false, ListingAttributes.empty());
  }

  /** Display name is best-effort and written once. */
  public Session captureDisplayName(String name) {
    if (displayName != null || name == null || name.isBlank()) {
      return this;
    }
    return withDisplayName(name.trim());
  }
}
