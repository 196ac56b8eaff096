package com.roomintake.whatsapp.store;

import com.roomintake.whatsapp.domain.Session;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-node session store for local runs ({@code intake.store.type=memory}).
 *
 * <p>For production and horizontal scaling, use the Redis store.
 */
@Component
@ConditionalOnProperty(name = "intake.store.type", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

  private final ExpiringMap<Session> sessions;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  InMemorySessionStore(Clock clock) {
    this.sessions = new ExpiringMap<>(clock);
  }

  @Override
  public Optional<Session> load(String partyId) {
    return sessions.get(StoreKeys.session(partyId));
  }

  @Override
  public void save(String partyId, Session session, Duration ttl) {
    sessions.put(StoreKeys.session(partyId), session, ttl);
  }
}
