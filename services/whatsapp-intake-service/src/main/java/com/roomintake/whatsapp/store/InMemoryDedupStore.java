package com.roomintake.whatsapp.store;

import com.roomintake.whatsapp.domain.DedupRecord;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "intake.store.type", havingValue = "memory")
public class InMemoryDedupStore implements DedupStore {

  private final ExpiringMap<DedupRecord> records;

  public InMemoryDedupStore() {
    this(Clock.systemUTC());
  }

  InMemoryDedupStore(Clock clock) {
    this.records = new ExpiringMap<>(clock);
  }

  @Override
  public Optional<DedupRecord> load(String partyId) {
    return records.get(StoreKeys.dedup(partyId));
  }

  @Override
  public void save(String partyId, DedupRecord record, Duration ttl) {
    records.put(StoreKeys.dedup(partyId), record, ttl);
  }
}
