package com.roomintake.whatsapp.domain;

import com.roomintake.whatsapp.model.InboundEvent;
import com.roomintake.whatsapp.model.Input;
import com.roomintake.whatsapp.model.InputKind;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Classifies a raw inbound event into exactly one {@link Input}. No side effects. */
@Component
public class InputNormalizer {

  private static final Set<String> GREETINGS = Set.of("hi", "hie", "hey", "hello");
  private static final Pattern NUMBER = Pattern.compile("^[0-9]+$");
  private static final Pattern DECIMAL = Pattern.compile("^[0-9]+(\\.[0-9]+)?$");

  public Input normalize(InboundEvent event) {
    if (event == null || event.messageType() == null) {
      return Input.unrecognized(null);
    }
    String type = event.messageType().trim().toLowerCase(Locale.ROOT);
    return switch (type) {
      case "image" -> new Input(InputKind.IMAGE, "image", "image");
      case "interactive" -> selection(event.selectionId());
      case "text" -> text(event.text());
      default -> Input.unrecognized(type);
    };
  }

  private static Input selection(String selectionId) {
    if (selectionId == null || selectionId.isBlank()) {
      return Input.unrecognized(selectionId);
    }
    return new Input(
        InputKind.SELECTION_ID, selectionId, selectionId.trim().toLowerCase(Locale.ROOT));
  }

  private static Input text(String body) {
    if (body == null || body.isBlank()) {
      return Input.unrecognized(body);
    }
    String trimmed = body.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (GREETINGS.contains(lower)) {
      return new Input(InputKind.GREETING, body, lower);
    }
    if (NUMBER.matcher(lower).matches()) {
      return new Input(InputKind.NUMBER, body, lower);
    }
    if (DECIMAL.matcher(lower).matches()) {
      return new Input(InputKind.DECIMAL, body, lower);
    }
    if (lower.equals("yes") || lower.equals("no")) {
      return new Input(InputKind.YES_NO, body, lower);
    }
    // free-text answers (age ranges etc.) keep their original casing
    return new Input(InputKind.FREE_TEXT, body, trimmed);
  }
}
