package com.roomintake.whatsapp.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomintake.whatsapp.domain.Session;
import com.roomintake.whatsapp.domain.StoreUnavailableException;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(name = "intake.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisSessionStore implements SessionStore {

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;

  public RedisSessionStore(StringRedisTemplate redis, ObjectMapper mapper) {
    this.redis = redis;
    this.mapper = mapper;
  }

  @Override
  public Optional<Session> load(String partyId) {
    String json;
    try {
      json = redis.opsForValue().get(StoreKeys.session(partyId));
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to load session for " + partyId, e);
    }
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(mapper.readValue(json, Session.class));
    } catch (JsonProcessingException e) {
      // unreadable record is treated like a missing one: the party starts over
      log.warn("Discarding unreadable session for {}: {}", partyId, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  @Override
  public void save(String partyId, Session session, Duration ttl) {
    String json;
    try {
      json = mapper.writeValueAsString(session);
    } catch (JsonProcessingException e) {
      throw new StoreUnavailableException("Failed to serialize session for " + partyId, e);
    }
    try {
      redis.opsForValue().set(StoreKeys.session(partyId), json, ttl);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to save session for " + partyId, e);
    }
  }
}
