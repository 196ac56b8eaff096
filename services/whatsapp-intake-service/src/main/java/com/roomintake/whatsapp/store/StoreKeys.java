package com.roomintake.whatsapp.store;

final class StoreKeys {

  private StoreKeys() {}

  static String session(String partyId) {
    return "user:" + partyId;
  }

  static String dedup(String partyId) {
    return "dedup:" + partyId;
  }
}
