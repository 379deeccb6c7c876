package com.flamingo.ai.pagereader.service.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

  private MutableClock clock;
  private TtlCache<String, Integer> cache;
  private AtomicInteger loads;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    cache = new TtlCache<>(clock, Duration.ofSeconds(30));
    loads = new AtomicInteger();
  }

  @Test
  void shouldServeCachedValueWithinTtl() {
    assertThat(cache.getOrRefresh("a", key -> loads.incrementAndGet())).isEqualTo(1);
    clock.advance(Duration.ofSeconds(29));

    assertThat(cache.getOrRefresh("a", key -> loads.incrementAndGet())).isEqualTo(1);
    assertThat(loads).hasValue(1);
  }

  @Test
  void shouldReloadAfterExpiry() {
    cache.getOrRefresh("a", key -> loads.incrementAndGet());
    clock.advance(Duration.ofSeconds(30));

    assertThat(cache.getOrRefresh("a", key -> loads.incrementAndGet())).isEqualTo(2);
  }

  @Test
  void shouldNotCacheLoaderFailure() {
    assertThatThrownBy(
            () ->
                cache.getOrRefresh(
                    "a",
                    key -> {
                      throw new IllegalStateException("database down");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(cache.size()).isZero();
    assertThat(cache.getOrRefresh("a", key -> 7)).isEqualTo(7);
  }

  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
