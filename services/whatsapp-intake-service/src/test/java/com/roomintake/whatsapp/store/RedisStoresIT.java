package com.roomintake.whatsapp.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomintake.whatsapp.config.IntakeProperties;
import com.roomintake.whatsapp.domain.DedupFilter;
import com.roomintake.whatsapp.domain.ListingAttributes;
import com.roomintake.whatsapp.domain.Session;
import com.roomintake.whatsapp.domain.Step;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers
class RedisStoresIT {

  @Container
  static GenericContainer<?> redis =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  static LettuceConnectionFactory connections;
  static StringRedisTemplate template;

  @BeforeAll
  static void connect() {
    connections =
        new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
    connections.afterPropertiesSet();
    template = new StringRedisTemplate(connections);
  }

  @AfterAll
  static void close() {
    connections.destroy();
  }

  @Test
  void sessionRoundTripsAndCarriesTtl() {
    RedisSessionStore store = new RedisSessionStore(template, new ObjectMapper());
    Session s =
        Session.fresh("it-1")
            .withStep(Step.ASKING_AGE)
            .withAttributes(ListingAttributes.empty().withRent3(new BigDecimal("60")));

    store.save("it-1", s, Duration.ofHours(48));

    assertThat(store.load("it-1")).contains(s);
    assertThat(template.getExpire("user:it-1")).isBetween(47L * 3600, 48L * 3600);
  }

  @Test
  void dedupFilterWorksAgainstRedis() {
    DedupFilter filter =
        new DedupFilter(
            new RedisDedupStore(template, new ObjectMapper()), IntakeProperties.defaults());

    assertThat(filter.shouldProcess("it-2", "wamid.1")).isTrue();
    assertThat(filter.shouldProcess("it-2", "wamid.1")).isFalse();
    assertThat(template.getExpire("dedup:it-2")).isPositive();
  }
}
