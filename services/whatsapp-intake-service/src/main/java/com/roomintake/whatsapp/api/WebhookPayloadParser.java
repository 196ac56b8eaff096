package com.roomintake.whatsapp.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.roomintake.whatsapp.model.InboundEvent;
import org.springframework.stereotype.Component;

/**
 * Extracts the single message of a WhatsApp Cloud webhook delivery.
 *
 * <p>Only {@code entry[0].changes[0].value} is read; the provider sends at most one message per
 * call. Deliveries without messages are status callbacks (sent, read, ...).
 */
@Component
public class WebhookPayloadParser {

  public enum Outcome {
    MESSAGE,
    INVALID,
    NO_MESSAGES,
    NO_SENDER
  }

  public record Parsed(Outcome outcome, InboundEvent event) {
    static Parsed of(Outcome outcome) {
      return new Parsed(outcome, null);
    }
  }

  public Parsed parse(JsonNode root) {
    JsonNode entry = root == null ? null : root.path("entry");
    if (entry == null || !entry.isArray() || entry.isEmpty()) {
      return Parsed.of(Outcome.INVALID);
    }
    JsonNode value = entry.path(0).path("changes").path(0).path("value");
    JsonNode messages = value.path("messages");
    if (!messages.isArray() || messages.isEmpty()) {
      return Parsed.of(Outcome.NO_MESSAGES);
    }

    JsonNode message = messages.path(0);
    String sender = textOrNull(message.path("from"));
    if (sender == null || sender.isBlank()) {
      return Parsed.of(Outcome.NO_SENDER);
    }

    String name = textOrNull(value.path("contacts").path(0).path("profile").path("name"));
    String type = textOrNull(message.path("type"));
    String deliveryId = textOrNull(message.path("id"));
    String text = textOrNull(message.path("text").path("body"));
    String selectionId = null;

    if ("interactive".equals(type)) {
      JsonNode interactive = message.path("interactive");
      String kind = interactive.path("type").asText("");
      selectionId = textOrNull(interactive.path(kind).path("id"));
    } else if ("button".equals(type)) {
      // quick-reply buttons of template messages arrive with their own type
      type = "interactive";
      selectionId = textOrNull(message.path("button").path("payload"));
    }

    return new Parsed(
        Outcome.MESSAGE, new InboundEvent(deliveryId, sender, name, type, text, selectionId));
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    return node.asText();
  }
}
