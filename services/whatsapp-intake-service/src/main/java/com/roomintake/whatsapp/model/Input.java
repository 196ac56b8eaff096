package com.roomintake.whatsapp.model;

import java.util.Locale;

/** Canonical form of an inbound event. Never persisted. */
public record Input(InputKind kind, String raw, String normalized) {

  public static Input unrecognized(String raw) {
    return new Input(InputKind.UNRECOGNIZED, raw, null);
  }

  public boolean is(InputKind k) {
    return kind == k;
  }

  /** Textual or selected value usable for token matching, lower-cased; null for media. */
  public String token() {
    return switch (kind) {
      case SELECTION_ID, YES_NO, FREE_TEXT, ROLE_CHOICE, GREETING, NUMBER, DECIMAL ->
          normalized == null ? null : normalized.toLowerCase(Locale.ROOT);
      case IMAGE, UNRECOGNIZED -> null;
    };
  }

  public boolean matches(String expected) {
    String t = token();
    return t != null && t.equals(expected);
  }
}
