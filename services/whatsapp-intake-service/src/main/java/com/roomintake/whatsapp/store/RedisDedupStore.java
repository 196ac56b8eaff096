package com.roomintake.whatsapp.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomintake.whatsapp.domain.DedupRecord;
import com.roomintake.whatsapp.domain.StoreUnavailableException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Stores the recent delivery ids as a plain JSON array under {@code dedup:<partyId>}. */
@Component
@Slf4j
@ConditionalOnProperty(name = "intake.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisDedupStore implements DedupStore {

  private static final TypeReference<List<String>> IDS = new TypeReference<>() {};

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;

  public RedisDedupStore(StringRedisTemplate redis, ObjectMapper mapper) {
    this.redis = redis;
    this.mapper = mapper;
  }

  @Override
  public Optional<DedupRecord> load(String partyId) {
    String json;
    try {
      json = redis.opsForValue().get(StoreKeys.dedup(partyId));
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to load dedup record for " + partyId, e);
    }
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new DedupRecord(mapper.readValue(json, IDS)));
    } catch (JsonProcessingException e) {
      log.warn("Discarding unreadable dedup record for {}: {}", partyId, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  @Override
  public void save(String partyId, DedupRecord record, Duration ttl) {
    try {
      redis
          .opsForValue()
          .set(StoreKeys.dedup(partyId), mapper.writeValueAsString(record.recentEventIds()), ttl);
    } catch (JsonProcessingException e) {
      throw new StoreUnavailableException("Failed to serialize dedup record for " + partyId, e);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to save dedup record for " + partyId, e);
    }
  }
}
