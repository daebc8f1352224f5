package com.flamingo.ai.scriptrag.embedding.store;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Composes a fast primary store with an optional durable secondary.
 *
 * <p>Writes go to the primary first and its failures propagate; the secondary is written on a best
 * effort basis. Reads that miss the primary fall back to the secondary and repopulate the primary.
 * Search only consults the primary.
 */
@Slf4j
public class HybridVectorStore implements VectorStore {

  static final String SECONDARY_FAILURE_METRIC = "vector.store.secondary.failure";

  private final VectorStore primary;
  private final VectorStore secondary;
  private final BestEffortWriter bestEffort;

  public HybridVectorStore(
      VectorStore primary, VectorStore secondary, MeterRegistry meterRegistry) {
    this.primary = primary;
    this.secondary = secondary;
    this.bestEffort = new BestEffortWriter(meterRegistry, SECONDARY_FAILURE_METRIC);
  }

  public VectorStore getPrimary() {
    return primary;
  }

  public Optional<VectorStore> getSecondary() {
    return Optional.ofNullable(secondary);
  }

  @Override
  public void store(
      String entityType,
      long entityId,
      float[] vector,
      String model,
      Map<String, Object> metadata) {
    primary.store(entityType, entityId, vector, model, metadata);
    if (secondary != null) {
      bestEffort.run(
          "secondary store", () -> secondary.store(entityType, entityId, vector, model, metadata));
    }
  }

  @Override
  public Optional<float[]> retrieve(String entityType, long entityId, String model) {
    Optional<float[]> result = primary.retrieve(entityType, entityId, model);
    if (result.isPresent() || secondary == null) {
      return result;
    }
    Optional<float[]> fromSecondary = secondary.retrieve(entityType, entityId, model);
    fromSecondary.ifPresent(
        vector -> {
          log.debug(
              "Restoring embedding to primary: entityType={}, entityId={}, model={}",
              entityType,
              entityId,
              model);
          bestEffort.run(
              "primary restore", () -> primary.store(entityType, entityId, vector, model, null));
        });
    return fromSecondary;
  }

  @Override
  public boolean delete(String entityType, long entityId, String model) {
    boolean deleted = primary.delete(entityType, entityId, model);
    if (secondary != null) {
      boolean secondaryDeleted =
          bestEffort
              .call("secondary delete", () -> secondary.delete(entityType, entityId, model))
              .orElse(false);
      deleted = deleted || secondaryDeleted;
    }
    return deleted;
  }

  @Override
  public boolean exists(String entityType, long entityId, String model) {
    if (primary.exists(entityType, entityId, model)) {
      return true;
    }
    return secondary != null && secondary.exists(entityType, entityId, model);
  }

  @Override
  public boolean supportsSearch() {
    return primary.supportsSearch();
  }

  @Override
  public List<VectorMatch> search(
      float[] queryVector,
      String entityType,
      String model,
      int limit,
      Double threshold,
      Map<String, Object> filter) {
    return primary.search(queryVector, entityType, model, limit, threshold, filter);
  }
}
