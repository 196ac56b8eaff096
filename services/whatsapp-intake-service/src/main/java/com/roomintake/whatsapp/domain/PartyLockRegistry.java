package com.roomintake.whatsapp.domain;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Serializes work per party id with a fixed set of striped locks. Two parties may share a stripe;
 * one party always maps to the same one.
 */
@Component
public class PartyLockRegistry {

  private final ReentrantLock[] stripes;

  public PartyLockRegistry(@Value("${intake.lock.stripes:64}") int stripes) {
    if (stripes < 1) {
      throw new IllegalArgumentException("intake.lock.stripes must be positive");
    }
    this.stripes = new ReentrantLock[stripes];
    for (int i = 0; i < stripes; i++) {
      this.stripes[i] = new ReentrantLock();
    }
  }

  public <T> T withLock(String partyId, Supplier<T> work) {
    ReentrantLock lock = lockFor(partyId);
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }

  ReentrantLock lockFor(String partyId) {
    int h = partyId == null ? 0 : partyId.hashCode();
    return stripes[Math.floorMod(h, stripes.length)];
  }
}
