package com.flamingo.ai.scriptrag.embedding.pipeline;

import com.flamingo.ai.scriptrag.embedding.batch.BatchItem;
import com.flamingo.ai.scriptrag.embedding.batch.BatchProcessor;
import com.flamingo.ai.scriptrag.embedding.batch.BatchResult;
import com.flamingo.ai.scriptrag.embedding.cache.EmbeddingCache;
import com.flamingo.ai.scriptrag.embedding.dimension.ModelDimensionRegistry;
import com.flamingo.ai.scriptrag.embedding.preprocess.PreprocessingStep;
import com.flamingo.ai.scriptrag.embedding.preprocess.ScreenplayPreprocessor;
import com.flamingo.ai.scriptrag.embedding.preprocess.StandardPreprocessor;
import com.flamingo.ai.scriptrag.embedding.preprocess.TextPreprocessor;
import com.flamingo.ai.scriptrag.exception.EmbeddingGenerationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw text into embeddings: preprocess, consult the cache, generate misses in batches, then
 * populate the cache.
 *
 * <p>The cache handed to the constructor belongs to this pipeline and is not shared. Vectors whose
 * length differs from what the model is expected to produce are logged and still returned.
 */
@Slf4j
public class EmbeddingPipeline {

  private static final String ELLIPSIS = "...";

  private final String model;
  private final Integer dimensions;
  private final int maxTextLength;
  private final BatchProcessor batchProcessor;
  private final EmbeddingCache cache;
  private final ModelDimensionRegistry dimensionRegistry;
  private final MeterRegistry meterRegistry;
  private final TextPreprocessor preprocessor;
  private final TextPreprocessor scenePreprocessor = new ScreenplayPreprocessor();

  /**
   * @param model embedding model name
   * @param dimensions requested output dimensions, or null for the model default
   * @param maxTextLength processed texts longer than this are cut and marked with {@code ...}
   * @param preprocessor default preprocessor
   * @param batchProcessor generates embeddings for cache misses
   * @param cache cache owned by this pipeline, or null to disable caching
   * @param dimensionRegistry expected dimensions by model
   * @param meterRegistry metrics
   */
  public EmbeddingPipeline(
      String model,
      Integer dimensions,
      int maxTextLength,
      TextPreprocessor preprocessor,
      BatchProcessor batchProcessor,
      EmbeddingCache cache,
      ModelDimensionRegistry dimensionRegistry,
      MeterRegistry meterRegistry) {
    this.model = model;
    this.dimensions = dimensions;
    this.maxTextLength = maxTextLength;
    this.preprocessor = preprocessor;
    this.batchProcessor = batchProcessor;
    this.cache = cache;
    this.dimensionRegistry = dimensionRegistry;
    this.meterRegistry = meterRegistry;
  }

  public String getModel() {
    return model;
  }

  TextPreprocessor getPreprocessor() {
    return preprocessor;
  }

  /**
   * Embeds a single text.
   *
   * @throws EmbeddingGenerationException if the provider reports an error or returns nothing
   */
  public float[] generateEmbedding(String text) {
    String processed = prepare(text, preprocessor);

    Optional<float[]> cached = lookup(processed);
    if (cached.isPresent()) {
      log.debug("Cache hit for embedding text of length {}", processed.length());
      return cached.get();
    }

    List<BatchResult> results =
        batchProcessor.processBatch(List.of(new BatchItem("0", processed)), model, dimensions);
    if (results.isEmpty()) {
      throw new EmbeddingGenerationException("Failed to generate embedding: Unknown error");
    }
    BatchResult result = results.get(0);
    if (!result.isSuccess()) {
      String reason = result.error() == null ? "Unknown error" : result.error();
      throw new EmbeddingGenerationException("Failed to generate embedding: " + reason);
    }

    float[] embedding = result.embedding();
    checkDimensions(embedding);
    if (cache != null) {
      cache.put(processed, model, embedding);
    }
    return embedding;
  }

  /** Embeds texts without metadata. See {@link #generateBatch(List, List)}. */
  public List<float[]> generateBatch(List<String> texts) {
    return generateBatch(texts, null);
  }

  /**
   * Embeds many texts. The returned list is aligned with {@code texts}; positions whose generation
   * failed hold null. Identical processed texts are generated once.
   *
   * @param texts texts to embed
   * @param metadata per-text metadata aligned with {@code texts}, or null
   */
  public List<float[]> generateBatch(List<String> texts, List<Map<String, Object>> metadata) {
    return generateBatch(texts, metadata, preprocessor);
  }

  private List<float[]> generateBatch(
      List<String> texts, List<Map<String, Object>> metadata, TextPreprocessor textPreprocessor) {
    if (metadata != null && metadata.size() != texts.size()) {
      throw new IllegalArgumentException(
          "metadata size " + metadata.size() + " does not match texts size " + texts.size());
    }
    float[][] embeddings = new float[texts.size()][];

    // processed text -> positions waiting for it, in first-seen order
    Map<String, List<Integer>> misses = new LinkedHashMap<>();
    for (int i = 0; i < texts.size(); i++) {
      String processed = prepare(texts.get(i), textPreprocessor);
      Optional<float[]> cached = lookup(processed);
      if (cached.isPresent()) {
        embeddings[i] = cached.get();
      } else {
        misses.computeIfAbsent(processed, k -> new ArrayList<>()).add(i);
      }
    }

    if (!misses.isEmpty()) {
      List<BatchItem> items = new ArrayList<>(misses.size());
      List<List<Integer>> positions = new ArrayList<>(misses.size());
      for (Map.Entry<String, List<Integer>> miss : misses.entrySet()) {
        int first = miss.getValue().get(0);
        items.add(
            new BatchItem(
                String.valueOf(first),
                miss.getKey(),
                metadata == null ? null : metadata.get(first)));
        positions.add(miss.getValue());
      }
      log.debug(
          "Generating {} embeddings ({} served from cache)",
          items.size(),
          texts.size() - countPositions(positions));

      List<BatchResult> results = batchProcessor.processBatch(items, model, dimensions);
      for (int j = 0; j < results.size() && j < items.size(); j++) {
        BatchResult result = results.get(j);
        if (!result.isSuccess()) {
          log.warn("Embedding generation failed for item {}: {}", result.id(), result.error());
          continue;
        }
        float[] embedding = result.embedding();
        checkDimensions(embedding);
        if (cache != null) {
          cache.put(items.get(j).text(), model, embedding);
        }
        for (int position : positions.get(j)) {
          embeddings[position] = embedding.clone();
        }
      }
    }
    return Arrays.asList(embeddings);
  }

  /**
   * Embeds scenes as {@code "Scene: {heading}\n\n{content}"} using screenplay-aware preprocessing.
   * Only this call sees the screenplay preprocessor; concurrent calls keep the default one.
   */
  public List<SceneEmbedding> generateForScenes(List<SceneText> scenes) {
    List<String> texts = scenes.stream().map(SceneText::toEmbeddingText).toList();
    List<float[]> embeddings = generateBatch(texts, null, scenePreprocessor);
    List<SceneEmbedding> results = new ArrayList<>(scenes.size());
    for (int i = 0; i < scenes.size(); i++) {
      results.add(new SceneEmbedding(scenes.get(i).id(), embeddings.get(i)));
    }
    return results;
  }

  /** Empties the cache; 0 when caching is disabled. */
  public int clearCache() {
    if (cache == null) {
      return 0;
    }
    int cleared = cache.clear();
    log.info("Cleared {} cached embeddings", cleared);
    return cleared;
  }

  public PipelineStats getStats() {
    List<String> steps =
        preprocessor instanceof StandardPreprocessor standard
            ? standard.getSteps().stream().map(PreprocessingStep::name).toList()
            : List.of();
    return new PipelineStats(
        model,
        dimensions,
        steps,
        maxTextLength,
        batchProcessor.getBatchSize(),
        cache == null ? Optional.empty() : Optional.of(cache.getStats()));
  }

  private String prepare(String text, TextPreprocessor textPreprocessor) {
    String processed = textPreprocessor.process(text);
    if (processed.length() > maxTextLength) {
      processed = processed.substring(0, maxTextLength) + ELLIPSIS;
    }
    return processed;
  }

  private Optional<float[]> lookup(String processed) {
    if (cache == null) {
      return Optional.empty();
    }
    Optional<float[]> cached = cache.get(processed, model);
    meterRegistry.counter(cached.isPresent() ? "embedding.cache.hits" : "embedding.cache.misses")
        .increment();
    return cached;
  }

  private void checkDimensions(float[] embedding) {
    OptionalInt expected =
        dimensions != null ? OptionalInt.of(dimensions) : dimensionRegistry.getDimensions(model);
    if (expected.isPresent() && expected.getAsInt() != embedding.length) {
      log.warn(
          "Dimension mismatch for model {}: expected {}, got {}",
          model,
          expected.getAsInt(),
          embedding.length);
    }
  }

  private static int countPositions(List<List<Integer>> positions) {
    int count = 0;
    for (List<Integer> p : positions) {
      count += p.size();
    }
    return count;
  }
}
