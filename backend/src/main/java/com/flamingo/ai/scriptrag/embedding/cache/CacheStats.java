package com.flamingo.ai.scriptrag.embedding.cache;

import java.util.Set;

/**
 * Point-in-time view of the cache.
 *
 * @param entries number of cached vectors
 * @param approxSizeBytes float payload size, four bytes per component
 * @param models distinct models with at least one cached vector
 * @param strategy the eviction strategy in use
 * @param maxSize capacity
 */
public record CacheStats(
    int entries,
    long approxSizeBytes,
    Set<String> models,
    InvalidationStrategy strategy,
    int maxSize) {}
