package com.roomintake.whatsapp.model;

import java.util.List;

/**
 * What to send next, independent of the provider wire format.
 *
 * <p>Option counts are checked here, not in the gateway: a list carries at most 10 rows and a
 * button message at most 3 buttons.
 */
public record OutboundDirective(
    DirectiveForm form, String recipient, String title, String body, List<String> options) {

  public OutboundDirective {
    if (form == null) {
      throw new IllegalArgumentException("form is required");
    }
    options = options == null ? List.of() : List.copyOf(options);
    if (options.size() > form.maxOptions()) {
      throw new IllegalArgumentException(
          form + " allows at most " + form.maxOptions() + " options, got " + options.size());
    }
  }

  public static OutboundDirective text(String recipient, String body) {
    return new OutboundDirective(DirectiveForm.TEXT, recipient, null, body, List.of());
  }

  public static OutboundDirective list(
      String recipient, String title, String body, List<String> options) {
    return new OutboundDirective(DirectiveForm.SINGLE_SELECT_LIST, recipient, title, body, options);
  }

  public static OutboundDirective buttons(String recipient, String body, List<String> options) {
    return new OutboundDirective(DirectiveForm.QUICK_REPLY_BUTTONS, recipient, null, body, options);
  }

  public static OutboundDirective none(String recipient) {
    return new OutboundDirective(DirectiveForm.NONE, recipient, null, null, List.of());
  }

  public boolean isNoop() {
    return form == DirectiveForm.NONE;
  }
}
