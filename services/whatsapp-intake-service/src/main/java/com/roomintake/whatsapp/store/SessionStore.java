package com.roomintake.whatsapp.store;

import com.roomintake.whatsapp.domain.Session;
import java.time.Duration;
import java.util.Optional;

/**
 * Durable party-id to session mapping. {@code save} replaces the whole record and restarts its
 * expiry. Backend failures surface as {@link
 * com.roomintake.whatsapp.domain.StoreUnavailableException}.
 */
public interface SessionStore {
  Optional<Session> load(String partyId);

  void save(String partyId, Session session, Duration ttl);
}
