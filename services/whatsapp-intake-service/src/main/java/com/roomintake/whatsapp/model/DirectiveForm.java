package com.roomintake.whatsapp.model;

public enum DirectiveForm {
  TEXT(0),
  SINGLE_SELECT_LIST(10),
  QUICK_REPLY_BUTTONS(3),
  /** Nothing to send: the delivery was already handled. */
  NONE(0);

  private final int maxOptions;

  DirectiveForm(int maxOptions) {
    this.maxOptions = maxOptions;
  }

  public int maxOptions() {
    return maxOptions;
  }
}
