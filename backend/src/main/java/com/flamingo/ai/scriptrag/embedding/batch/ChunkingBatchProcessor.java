package com.flamingo.ai.scriptrag.embedding.batch;

import com.flamingo.ai.scriptrag.llm.EmbeddingProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch processor that splits long texts into overlapping windows before embedding.
 *
 * <p>Each window becomes its own task with id {@code {parentId}_chunk_{i}} and metadata {@code
 * parent_id} / {@code chunk_index}. Chunk embeddings are returned as-is; combining them into one
 * vector per parent is left to the caller.
 */
@Slf4j
public class ChunkingBatchProcessor extends BatchProcessor {

  public static final String PARENT_ID = "parent_id";
  public static final String CHUNK_INDEX = "chunk_index";

  private static final String[] SENTENCE_BREAKS = {".", "!", "?", "\n\n"};

  private final int chunkSize;
  private final int chunkOverlap;

  public ChunkingBatchProcessor(
      EmbeddingProvider provider,
      int batchSize,
      Executor executor,
      MeterRegistry meterRegistry,
      int chunkSize,
      int chunkOverlap) {
    super(provider, batchSize, executor, meterRegistry);
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "chunkOverlap must be in [0, chunkSize): " + chunkOverlap);
    }
    this.chunkSize = chunkSize;
    this.chunkOverlap = chunkOverlap;
  }

  /**
   * Splits text into windows of at most {@code chunkSize} characters; consecutive windows share
   * {@code chunkOverlap} characters. A window is shortened to end at a sentence break when one
   * exists past its midpoint.
   */
  public List<String> chunkText(String text) {
    if (text.length() <= chunkSize) {
      return List.of(text);
    }
    List<String> chunks = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + chunkSize, text.length());
      if (end < text.length()) {
        end = adjustToSentenceBreak(text, start, end);
      }
      chunks.add(text.substring(start, end));

      int next = end - chunkOverlap;
      if (next <= start) {
        next = end;
      }
      start = next;
      if (start >= text.length() - chunkOverlap) {
        break;
      }
    }
    return chunks;
  }

  /** Expands long items into chunk tasks and embeds everything. */
  public List<BatchResult> processWithChunking(
      List<BatchItem> items, String model, Integer dimensions) {
    List<BatchItem> tasks = new ArrayList<>();
    for (BatchItem item : items) {
      List<String> chunks = chunkText(item.text());
      if (chunks.size() == 1) {
        tasks.add(item);
        continue;
      }
      log.debug("Split item {} into {} chunks", item.id(), chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        Map<String, Object> metadata = new HashMap<>();
        if (item.metadata() != null) {
          metadata.putAll(item.metadata());
        }
        metadata.put(PARENT_ID, item.id());
        metadata.put(CHUNK_INDEX, i);
        tasks.add(new BatchItem(item.id() + "_chunk_" + i, chunks.get(i), metadata));
      }
    }
    return processBatch(tasks, model, dimensions);
  }

  private int adjustToSentenceBreak(String text, int start, int end) {
    for (String sep : SENTENCE_BREAKS) {
      int lastSep = text.lastIndexOf(sep, end - sep.length());
      if (lastSep >= start && lastSep > start + chunkSize / 2) {
        return lastSep + 1;
      }
    }
    return end;
  }
}
