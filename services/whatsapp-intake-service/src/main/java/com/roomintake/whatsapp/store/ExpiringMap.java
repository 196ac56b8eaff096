package com.roomintake.whatsapp.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Minimal in-memory key/value map with per-entry expiry, checked lazily on read. */
final class ExpiringMap<V> {

  private final ConcurrentMap<String, Entry<V>> map = new ConcurrentHashMap<>();
  private final Clock clock;

  ExpiringMap(Clock clock) {
    this.clock = clock;
  }

  Optional<V> get(String key) {
    Entry<V> e = map.get(key);
    if (e == null) {
      return Optional.empty();
    }
    if (!e.expiresAt.isAfter(clock.instant())) {
      map.remove(key, e);
      return Optional.empty();
    }
    return Optional.of(e.value);
  }

  void put(String key, V value, Duration ttl) {
    map.put(key, new Entry<>(value, clock.instant().plus(ttl)));
  }

  private record Entry<V>(V value, Instant expiresAt) {}
}
