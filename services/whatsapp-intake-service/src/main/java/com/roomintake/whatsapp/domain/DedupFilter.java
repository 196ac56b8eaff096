package com.roomintake.whatsapp.domain;

import com.roomintake.whatsapp.config.IntakeProperties;
import com.roomintake.whatsapp.store.DedupStore;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Suppresses webhook deliveries the provider retries. Keeps the last few delivery ids per party;
 * a party without a record has seen nothing yet. Blank delivery ids are never deduplicated.
 */
@Service
public class DedupFilter {

  private final DedupStore store;
  private final Duration ttl;
  private final int capacity;

  public DedupFilter(DedupStore store, IntakeProperties properties) {
    this.store = store;
    this.ttl = properties.dedup().ttl();
    this.capacity = properties.dedup().capacity();
  }

  /** Checks and records in one go: false when the delivery was already seen. */
  public boolean shouldProcess(String partyId, String deliveryId) {
    if (isDuplicate(partyId, deliveryId)) {
      return false;
    }
    record(partyId, deliveryId);
    return true;
  }

  public boolean isDuplicate(String partyId, String deliveryId) {
    if (deliveryId == null || deliveryId.isBlank()) {
      return false;
    }
    return store.load(partyId).map(r -> r.contains(deliveryId)).orElse(false);
  }

  public void record(String partyId, String deliveryId) {
    if (deliveryId == null || deliveryId.isBlank()) {
      return;
    }
    DedupRecord current = store.load(partyId).orElse(DedupRecord.empty());
    if (current.contains(deliveryId)) {
      return;
    }
    store.save(partyId, current.append(deliveryId, capacity), ttl);
  }
}
