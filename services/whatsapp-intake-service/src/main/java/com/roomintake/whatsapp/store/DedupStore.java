package com.roomintake.whatsapp.store;

import com.roomintake.whatsapp.domain.DedupRecord;
import java.time.Duration;
import java.util.Optional;

public interface DedupStore {
  Optional<DedupRecord> load(String partyId);

  void save(String partyId, DedupRecord record, Duration ttl);
}
