package com.roomintake.whatsapp.model;

/**
 * One inbound chat message as received from the provider, before any interpretation.
 *
 * <p>{@code messageType} is the provider's raw kind ({@code text}, {@code image}, {@code
 * interactive}, ...). {@code selectionId} is set for list-row and button replies.
 */
public record InboundEvent(
    String deliveryId,
    String partyId,
    String displayName,
    String messageType,
    String text,
    String selectionId) {

  public static InboundEvent text(String deliveryId, String partyId, String text) {
    return new InboundEvent(deliveryId, partyId, null, "text", text, null);
  }

  public static InboundEvent image(String deliveryId, String partyId) {
    return new InboundEvent(deliveryId, partyId, null, "image", null, null);
  }

  public static InboundEvent selection(String deliveryId, String partyId, String selectionId) {
    return new InboundEvent(deliveryId, partyId, null, "interactive", null, selectionId);
  }
}
