package com.flamingo.ai.scriptrag.embedding.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded in-memory cache of embeddings keyed by {@code sha256(model + ":" + text)}.
 *
 * <p>Every operation runs under one lock. With {@link InvalidationStrategy#LRU} reads refresh an
 * entry's position; with {@link InvalidationStrategy#TTL} entries older than the TTL are treated as
 * absent and removed when touched.
 */
@Slf4j
public class EmbeddingCache {

  private final InvalidationStrategy strategy;
  private final int maxSize;
  private final Duration ttl;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, CacheEntry> entries;

  public EmbeddingCache(InvalidationStrategy strategy, int maxSize, Duration ttl, Clock clock) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.strategy = strategy;
    this.maxSize = maxSize;
    this.ttl = ttl;
    this.clock = clock;
    this.entries = new LinkedHashMap<>(16, 0.75f, strategy == InvalidationStrategy.LRU);
  }

  public EmbeddingCache(InvalidationStrategy strategy, int maxSize, Duration ttl) {
    this(strategy, maxSize, ttl, Clock.systemUTC());
  }

  /** Cache key for a model and text. */
  public static String key(String text, String model) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest((model + ":" + text).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public Optional<float[]> get(String text, String model) {
    String key = key(text, model);
    lock.lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (isExpired(entry)) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry.embedding().clone());
    } finally {
      lock.unlock();
    }
  }

  public void put(String text, String model, float[] embedding) {
    String key = key(text, model);
    lock.lock();
    try {
      entries.remove(key);
      if (entries.size() >= maxSize) {
        evictOne();
      }
      entries.put(key, new CacheEntry(embedding.clone(), model, clock.instant()));
    } finally {
      lock.unlock();
    }
  }

  /** Drops one entry; true if it was present. */
  public boolean invalidate(String text, String model) {
    String key = key(text, model);
    lock.lock();
    try {
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  /** Drops every entry produced by a model and returns how many were removed. */
  public int invalidateModel(String model) {
    lock.lock();
    try {
      int before = entries.size();
      entries.values().removeIf(e -> e.model().equals(model));
      int removed = before - entries.size();
      log.debug("Invalidated {} cached embeddings for model {}", removed, model);
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** Drops entries stored before {@code now - age} and returns how many were removed. */
  public int cleanupOlderThan(Duration age) {
    Instant cutoff = clock.instant().minus(age);
    lock.lock();
    try {
      int before = entries.size();
      entries.values().removeIf(e -> e.createdAt().isBefore(cutoff));
      return before - entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** Empties the cache and returns the number of entries dropped. */
  public int clear() {
    lock.lock();
    try {
      int count = entries.size();
      entries.clear();
      return count;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public CacheStats getStats() {
    lock.lock();
    try {
      long bytes = 0;
      Set<String> models = new TreeSet<>();
      for (CacheEntry entry : entries.values()) {
        bytes += (long) entry.embedding().length * Float.BYTES;
        models.add(entry.model());
      }
      return new CacheStats(entries.size(), bytes, Set.copyOf(models), strategy, maxSize);
    } finally {
      lock.unlock();
    }
  }

  private boolean isExpired(CacheEntry entry) {
    return strategy == InvalidationStrategy.TTL
        && entry.createdAt().plus(ttl).isBefore(clock.instant());
  }

  // Caller holds the lock.
  private void evictOne() {
    if (strategy == InvalidationStrategy.TTL) {
      Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
      while (it.hasNext()) {
        if (isExpired(it.next().getValue())) {
          it.remove();
          return;
        }
      }
    }
    // Eldest in access order for LRU, in insertion order for TTL.
    Iterator<String> eldest = entries.keySet().iterator();
    if (eldest.hasNext()) {
      eldest.next();
      eldest.remove();
    }
  }
}
