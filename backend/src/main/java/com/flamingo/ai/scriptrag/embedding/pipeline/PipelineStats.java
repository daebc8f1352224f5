package com.flamingo.ai.scriptrag.embedding.pipeline;

import com.flamingo.ai.scriptrag.embedding.cache.CacheStats;
import java.util.List;
import java.util.Optional;

/** Configuration snapshot of a pipeline plus its cache statistics when caching is enabled. */
public record PipelineStats(
    String model,
    Integer dimensions,
    List<String> preprocessingSteps,
    int maxTextLength,
    int batchSize,
    Optional<CacheStats> cache) {}
