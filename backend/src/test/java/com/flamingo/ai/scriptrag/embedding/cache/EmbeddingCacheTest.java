package com.flamingo.ai.scriptrag.embedding.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EmbeddingCache Tests")
class EmbeddingCacheTest {

  /** Clock whose instant only moves when the test advances it. */
  static final class MutableClock extends Clock {
    private Instant now = Instant.parse("2024-01-01T00:00:00Z");

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

  @Test
  @DisplayName("Should key by model and text with a SHA-256 hex digest")
  void shouldBuildKeys() {
    assertThat(EmbeddingCache.key("hello", "m"))
        .hasSize(64)
        .isEqualTo(EmbeddingCache.key("hello", "m"));
    assertThat(EmbeddingCache.key("hello", "m")).isNotEqualTo(EmbeddingCache.key("hello", "n"));
  }

  @Test
  @DisplayName("Should return copies so callers cannot mutate cached vectors")
  void shouldReturnCopies() {
    EmbeddingCache cache = new EmbeddingCache(InvalidationStrategy.LRU, 10, Duration.ofDays(1));
    float[] vector = {1f, 2f};
    cache.put("text", "m", vector);
    vector[0] = 99f;

    float[] first = cache.get("text", "m").orElseThrow();
    first[1] = 42f;

    assertThat(cache.get("text", "m"))
        .hasValueSatisfying(v -> assertThat(v).containsExactly(1f, 2f));
  }

  @Nested
  @DisplayName("LRU strategy")
  class Lru {

    @Test
    @DisplayName("Should evict the least recently used entry when full")
    void shouldEvictLeastRecentlyUsed() {
      EmbeddingCache cache = new EmbeddingCache(InvalidationStrategy.LRU, 3, Duration.ofDays(1));
      cache.put("a", "m", new float[] {1f});
      cache.put("b", "m", new float[] {2f});
      cache.put("c", "m", new float[] {3f});
      cache.get("a", "m");

      cache.put("d", "m", new float[] {4f});

      assertThat(cache.size()).isEqualTo(3);
      assertThat(cache.get("b", "m")).isEmpty();
      assertThat(cache.get("a", "m")).isPresent();
      assertThat(cache.get("d", "m")).isPresent();
    }

    @Test
    @DisplayName("Should not evict when overwriting an existing key")
    void shouldOverwriteWithoutEviction() {
      EmbeddingCache cache = new EmbeddingCache(InvalidationStrategy.LRU, 2, Duration.ofDays(1));
      cache.put("a", "m", new float[] {1f});
      cache.put("b", "m", new float[] {2f});

      cache.put("a", "m", new float[] {5f});

      assertThat(cache.size()).isEqualTo(2);
      assertThat(cache.get("a", "m")).hasValueSatisfying(v -> assertThat(v).containsExactly(5f));
      assertThat(cache.get("b", "m")).isPresent();
    }
  }

  @Nested
  @DisplayName("TTL strategy")
  class Ttl {

    @Test
    @DisplayName("Should treat entries older than the TTL as absent")
    void shouldExpireEntries() {
      MutableClock clock = new MutableClock();
      EmbeddingCache cache =
          new EmbeddingCache(InvalidationStrategy.TTL, 10, Duration.ofHours(1), clock);
      cache.put("a", "m", new float[] {1f});

      clock.advance(Duration.ofMinutes(30));
      assertThat(cache.get("a", "m")).isPresent();

      clock.advance(Duration.ofMinutes(31));
      assertThat(cache.get("a", "m")).isEmpty();
      assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Should prefer evicting an expired entry when full")
    void shouldEvictExpiredFirst() {
      MutableClock clock = new MutableClock();
      EmbeddingCache cache =
          new EmbeddingCache(InvalidationStrategy.TTL, 2, Duration.ofHours(1), clock);
      cache.put("stale", "m", new float[] {1f});
      clock.advance(Duration.ofMinutes(50));
      cache.put("young", "m", new float[] {2f});
      clock.advance(Duration.ofMinutes(20));

      cache.put("new", "m", new float[] {3f});

      assertThat(cache.get("stale", "m")).isEmpty();
      assertThat(cache.get("young", "m")).isPresent();
      assertThat(cache.get("new", "m")).isPresent();
    }

    @Test
    @DisplayName("Should clean up entries older than a given age")
    void shouldCleanupOlderThan() {
      MutableClock clock = new MutableClock();
      EmbeddingCache cache =
          new EmbeddingCache(InvalidationStrategy.TTL, 10, Duration.ofDays(30), clock);
      cache.put("old", "m", new float[] {1f});
      clock.advance(Duration.ofDays(2));
      cache.put("recent", "m", new float[] {2f});

      assertThat(cache.cleanupOlderThan(Duration.ofDays(1))).isEqualTo(1);
      assertThat(cache.get("recent", "m")).isPresent();
    }
  }

  @Nested
  @DisplayName("Invalidation and stats")
  class Invalidation {

    @Test
    @DisplayName("Should invalidate single entries and whole models")
    void shouldInvalidate() {
      EmbeddingCache cache = new EmbeddingCache(InvalidationStrategy.LRU, 10, Duration.ofDays(1));
      cache.put("a", "m1", new float[] {1f});
      cache.put("b", "m1", new float[] {1f});
      cache.put("a", "m2", new float[] {1f});

      assertThat(cache.invalidate("a", "m2")).isTrue();
      assertThat(cache.invalidate("a", "m2")).isFalse();
      assertThat(cache.invalidateModel("m1")).isEqualTo(2);
      assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Should report entries, payload size and models")
    void shouldReportStats() {
      EmbeddingCache cache = new EmbeddingCache(InvalidationStrategy.LRU, 10, Duration.ofDays(1));
      cache.put("a", "m1", new float[] {1f, 2f, 3f});
      cache.put("b", "m2", new float[] {1f});

      CacheStats stats = cache.getStats();

      assertThat(stats.entries()).isEqualTo(2);
      assertThat(stats.approxSizeBytes()).isEqualTo(16);
      assertThat(stats.models()).containsExactlyInAnyOrder("m1", "m2");
      assertThat(stats.strategy()).isEqualTo(InvalidationStrategy.LRU);
      assertThat(stats.maxSize()).isEqualTo(10);
      assertThat(cache.clear()).isEqualTo(2);
      assertThat(cache.size()).isZero();
    }
  }
}
