package com.flamingo.ai.scriptrag.embedding.batch;

import com.flamingo.ai.scriptrag.llm.EmbeddingProvider;
import com.flamingo.ai.scriptrag.llm.EmbeddingRequest;
import com.flamingo.ai.scriptrag.llm.EmbeddingResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups embedding requests into sub-batches and sends one provider call per sub-batch.
 *
 * <p>Sub-batches run concurrently on the supplied executor and are joined before returning. When
 * the executor rejects a sub-batch it runs on the calling thread instead. A failure is recorded on
 * the affected item only: when a whole sub-batch call fails, its items are retried one by one so
 * that siblings of a bad input still succeed.
 */
@Slf4j
public class BatchProcessor {

  // Rough heuristic for English prose.
  private static final int CHARS_PER_TOKEN = 4;

  private final EmbeddingProvider provider;
  private final int batchSize;
  private final Executor executor;
  protected final MeterRegistry meterRegistry;

  public BatchProcessor(
      EmbeddingProvider provider, int batchSize, Executor executor, MeterRegistry meterRegistry) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    this.provider = provider;
    this.batchSize = batchSize;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  public int getBatchSize() {
    return batchSize;
  }

  /**
   * Embeds every item. Results are returned in input order, one per item.
   *
   * @param items items to embed
   * @param model embedding model name
   * @param dimensions requested output dimensions, or null
   * @return one result per item
   */
  public List<BatchResult> processBatch(List<BatchItem> items, String model, Integer dimensions) {
    if (items.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<CompletableFuture<List<BatchResult>>> futures = new ArrayList<>();
      for (int start = 0; start < items.size(); start += batchSize) {
        List<BatchItem> subBatch = items.subList(start, Math.min(start + batchSize, items.size()));
        futures.add(submit(subBatch, model, dimensions));
      }
      List<BatchResult> results = new ArrayList<>(items.size());
      for (CompletableFuture<List<BatchResult>> future : futures) {
        results.addAll(future.join());
      }
      long failures = results.stream().filter(r -> !r.isSuccess()).count();
      if (failures > 0) {
        meterRegistry.counter("embedding.batch.failures").increment(failures);
      }
      log.debug(
          "Processed {} items in {} sub-batches, {} failed",
          items.size(),
          futures.size(),
          failures);
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private CompletableFuture<List<BatchResult>> submit(
      List<BatchItem> subBatch, String model, Integer dimensions) {
    try {
      return CompletableFuture.supplyAsync(
          () -> processSubBatch(subBatch, model, dimensions), executor);
    } catch (RejectedExecutionException e) {
      log.debug("Executor saturated, running sub-batch of {} items inline", subBatch.size());
      return CompletableFuture.completedFuture(processSubBatch(subBatch, model, dimensions));
    }
  }

  private List<BatchResult> processSubBatch(
      List<BatchItem> subBatch, String model, Integer dimensions) {
    try {
      return callProvider(subBatch, model, dimensions);
    } catch (RuntimeException e) {
      if (subBatch.size() == 1) {
        log.warn("Embedding failed for item {}: {}", subBatch.get(0).id(), e.getMessage());
        return List.of(BatchResult.failure(subBatch.get(0), e.getMessage()));
      }
      log.warn(
          "Sub-batch of {} items failed ({}), retrying items individually",
          subBatch.size(),
          e.getMessage());
      List<BatchResult> results = new ArrayList<>(subBatch.size());
      for (BatchItem item : subBatch) {
        try {
          results.addAll(callProvider(List.of(item), model, dimensions));
        } catch (RuntimeException itemError) {
          log.warn("Embedding failed for item {}: {}", item.id(), itemError.getMessage());
          results.add(BatchResult.failure(item, itemError.getMessage()));
        }
      }
      return results;
    }
  }

  private List<BatchResult> callProvider(
      List<BatchItem> subBatch, String model, Integer dimensions) {
    List<String> texts = subBatch.stream().map(BatchItem::text).toList();
    EmbeddingResponse response = provider.embed(new EmbeddingRequest(model, texts, dimensions));

    Map<Integer, float[]> byIndex = new HashMap<>();
    if (response != null) {
      for (EmbeddingResponse.EmbeddingData data : response.data()) {
        byIndex.put(data.index(), data.embedding());
      }
    }
    List<BatchResult> results = new ArrayList<>(subBatch.size());
    for (int i = 0; i < subBatch.size(); i++) {
      float[] embedding = byIndex.get(i);
      if (embedding == null || embedding.length == 0) {
        results.add(BatchResult.failure(subBatch.get(i), "No embedding in response"));
      } else {
        results.add(BatchResult.success(subBatch.get(i), embedding));
      }
    }
    return results;
  }

  /** Approximate token count, about four characters per token. */
  public int estimateTokens(String text) {
    return text.length() / CHARS_PER_TOKEN;
  }

  /**
   * Plans sub-batches that stay under a token budget and never exceed the batch size. An item that
   * alone exceeds the budget gets a batch of its own.
   */
  public List<List<BatchItem>> optimizeBatches(List<BatchItem> items, int maxTokensPerBatch) {
    List<List<BatchItem>> batches = new ArrayList<>();
    List<BatchItem> current = new ArrayList<>();
    int currentTokens = 0;
    for (BatchItem item : items) {
      int tokens = estimateTokens(item.text());
      if (!current.isEmpty() && currentTokens + tokens > maxTokensPerBatch) {
        batches.add(current);
        current = new ArrayList<>();
        currentTokens = 0;
      }
      current.add(item);
      currentTokens += tokens;
      if (current.size() >= batchSize) {
        batches.add(current);
        current = new ArrayList<>();
        currentTokens = 0;
      }
    }
    if (!current.isEmpty()) {
      batches.add(current);
    }
    return batches;
  }
}
