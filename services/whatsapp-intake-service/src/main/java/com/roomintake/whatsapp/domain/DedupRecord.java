package com.roomintake.whatsapp.domain;

import java.util.ArrayList;
import java.util.List;

/** Recent delivery ids for one party, most recent last. */
public record DedupRecord(List<String> recentEventIds) {

  public DedupRecord {
    recentEventIds = recentEventIds == null ? List.of() : List.copyOf(recentEventIds);
  }

  public static DedupRecord empty() {
    return new DedupRecord(List.of());
  }

  public boolean contains(String deliveryId) {
    return recentEventIds.contains(deliveryId);
  }

  /** Appends the id, evicting the oldest entries first so the size never exceeds capacity. */
  public DedupRecord append(String deliveryId, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    List<String> next = new ArrayList<>(recentEventIds);
    while (next.size() >= capacity) {
      next.remove(0);
    }
    next.add(deliveryId);
    return new DedupRecord(next);
  }
}
