package com.roomintake.whatsapp.domain;

/** Session or dedup backend failed; no state transition may be assumed. */
public class StoreUnavailableException extends RuntimeException {
  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
