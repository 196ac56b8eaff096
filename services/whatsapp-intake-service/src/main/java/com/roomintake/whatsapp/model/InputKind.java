package com.roomintake.whatsapp.model;

public enum InputKind {
  GREETING,
  ROLE_CHOICE,
  YES_NO,
  FREE_TEXT,
  NUMBER,
  DECIMAL,
  IMAGE,
  SELECTION_ID,
  UNRECOGNIZED
}
