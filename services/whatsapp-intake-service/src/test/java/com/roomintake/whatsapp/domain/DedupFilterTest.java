package com.roomintake.whatsapp.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.roomintake.whatsapp.config.IntakeProperties;
import com.roomintake.whatsapp.store.InMemoryDedupStore;
import java.util.List;
import org.junit.jupiter.api.Test;

class DedupFilterTest {

  private final InMemoryDedupStore store = new InMemoryDedupStore();
  private final DedupFilter filter = new DedupFilter(store, IntakeProperties.defaults());

  @Test
  void unseenDeliveryIsProcessedOnce() {
    assertThat(filter.shouldProcess("p1", "a")).isTrue();
    assertThat(filter.shouldProcess("p1", "a")).isFalse();
  }

  @Test
  void recordsAreScopedPerParty() {
    filter.shouldProcess("p1", "a");

    assertThat(filter.shouldProcess("p2", "a")).isTrue();
  }

  @Test
  void oldestIdIsEvictedPastCapacity() {
    for (String id : List.of("a", "b", "c", "d", "e", "f")) {
      filter.shouldProcess("p1", id);
    }

    assertThat(store.load("p1").orElseThrow().recentEventIds())
        .containsExactly("b", "c", "d", "e", "f");
    assertThat(filter.isDuplicate("p1", "a")).isFalse();
    assertThat(filter.isDuplicate("p1", "f")).isTrue();
  }

  @Test
  void blankDeliveryIdIsNeverDuplicate() {
    assertThat(filter.shouldProcess("p1", null)).isTrue();
    assertThat(filter.shouldProcess("p1", null)).isTrue();
    assertThat(filter.shouldProcess("p1", " ")).isTrue();
    assertThat(store.load("p1")).isEmpty();
  }

  @Test
  void recordAppendRejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> DedupRecord.empty().append("a", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
