package com.flamingo.ai.scriptrag.embedding.cache;

import java.time.Instant;

/** A cached vector with the model that produced it and when it was stored. */
record CacheEntry(float[] embedding, String model, Instant createdAt) {}
