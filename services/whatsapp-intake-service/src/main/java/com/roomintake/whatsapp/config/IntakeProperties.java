package com.roomintake.whatsapp.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "intake")
public record IntakeProperties(Sessions session, Dedup dedup, Owner owner) {

  public IntakeProperties {
    session = session == null ? new Sessions(null) : session;
    dedup = dedup == null ? new Dedup(null, null) : dedup;
    owner = owner == null ? new Owner(null, false) : owner;
  }

  public static IntakeProperties defaults() {
    return new IntakeProperties(null, null, null);
  }

  /** Sliding expiry of a party's session, refreshed on every write. */
  public record Sessions(Duration ttl) {
    public Sessions {
      ttl = ttl == null ? Duration.ofHours(48) : ttl;
    }
  }

  /** Retry suppression window and how many recent delivery ids are kept per party. */
  public record Dedup(Duration ttl, Integer capacity) {
    public Dedup {
      ttl = ttl == null ? Duration.ofHours(1) : ttl;
      capacity = capacity == null || capacity < 1 ? 5 : capacity;
    }
  }

  /** Operator who receives confirmed listings. Blank phone disables notifications. */
  public record Owner(String phone, boolean notifyOnStartup) {
    public Owner {
      phone = phone == null ? "" : phone.trim();
    }

    public boolean isConfigured() {
      return !phone.isBlank();
    }
  }
}
