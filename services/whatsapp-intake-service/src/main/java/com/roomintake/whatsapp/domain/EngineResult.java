package com.roomintake.whatsapp.domain;

import com.roomintake.whatsapp.model.OutboundDirective;

/**
 * Outcome of one handled delivery.
 *
 * @param session committed session, null for a duplicate delivery
 * @param listingConfirmed caller must send the owner summary
 */
public record EngineResult(
    OutboundDirective directive, Session session, boolean duplicate, boolean listingConfirmed) {

  static EngineResult duplicate(String partyId) {
    return new EngineResult(OutboundDirective.none(partyId), null, true, false);
  }
}
