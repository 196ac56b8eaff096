package com.roomintake.whatsapp.domain;

import com.roomintake.whatsapp.model.OutboundDirective;

/**
 * Result of one table lookup.
 *
 * @param session session after the mutation; the same instance when nothing changed
 * @param rejected input did not fit the step, the step's prompt is re-emitted
 * @param listingConfirmed the landlord confirmed the listing, the owner must be notified
 */
public record Transition(
    Session session, OutboundDirective directive, boolean rejected, boolean listingConfirmed) {

  static Transition advance(Session next, OutboundDirective directive) {
    return new Transition(next, directive, false, false);
  }

  static Transition stay(Session current, OutboundDirective directive) {
    return new Transition(current, directive, false, false);
  }

  static Transition reject(Session current, OutboundDirective directive) {
    return new Transition(current, directive, true, false);
  }

  static Transition confirmed(Session next, OutboundDirective directive) {
    return new Transition(next, directive, false, true);
  }
}
