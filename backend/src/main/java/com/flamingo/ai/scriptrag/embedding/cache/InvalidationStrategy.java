package com.flamingo.ai.scriptrag.embedding.cache;

/** How the embedding cache chooses entries to drop. */
public enum InvalidationStrategy {
  /** Evict the least recently read entry once the cache is full. */
  LRU,
  /** Entries expire after a fixed age; the oldest goes first when full. */
  TTL
}
