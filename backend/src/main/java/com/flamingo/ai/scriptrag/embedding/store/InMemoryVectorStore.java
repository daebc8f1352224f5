package com.flamingo.ai.scriptrag.embedding.store;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe in-process vector store with exhaustive cosine-similarity search.
 *
 * <p>Every search scans all vectors of the requested entity type and model; there is no
 * approximate index.
 */
@Slf4j
public class InMemoryVectorStore implements VectorStore {

  private record Key(String entityType, long entityId, String model) {}

  private record Entry(float[] vector, Map<String, Object> metadata) {}

  private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

  @Override
  public void store(
      String entityType,
      long entityId,
      float[] vector,
      String model,
      Map<String, Object> metadata) {
    Map<String, Object> safeMetadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    entries.put(new Key(entityType, entityId, model), new Entry(vector.clone(), safeMetadata));
  }

  @Override
  public Optional<float[]> retrieve(String entityType, long entityId, String model) {
    Entry entry = entries.get(new Key(entityType, entityId, model));
    return entry == null ? Optional.empty() : Optional.of(entry.vector().clone());
  }

  @Override
  public boolean delete(String entityType, long entityId, String model) {
    if (model != null) {
      return entries.remove(new Key(entityType, entityId, model)) != null;
    }
    return entries
        .keySet()
        .removeIf(key -> key.entityType().equals(entityType) && key.entityId() == entityId);
  }

  @Override
  public boolean exists(String entityType, long entityId, String model) {
    return entries.containsKey(new Key(entityType, entityId, model));
  }

  @Override
  public boolean supportsSearch() {
    return true;
  }

  @Override
  public List<VectorMatch> search(
      float[] queryVector,
      String entityType,
      String model,
      int limit,
      Double threshold,
      Map<String, Object> filter) {
    List<VectorMatch> matches =
        entries.entrySet().stream()
            .filter(e -> e.getKey().entityType().equals(entityType))
            .filter(e -> e.getKey().model().equals(model))
            .filter(e -> e.getValue().vector().length == queryVector.length)
            .filter(e -> matchesFilter(e.getValue().metadata(), filter))
            .map(
                e ->
                    new VectorMatch(
                        e.getKey().entityId(),
                        VectorMath.cosineSimilarity(queryVector, e.getValue().vector()),
                        e.getValue().metadata()))
            .filter(m -> threshold == null || m.score() >= threshold)
            .sorted(
                Comparator.comparingDouble(VectorMatch::score)
                    .reversed()
                    .thenComparingLong(VectorMatch::entityId))
            .limit(Math.max(0, limit))
            .toList();
    log.debug(
        "In-memory search: entityType={}, model={}, matches={}", entityType, model, matches.size());
    return matches;
  }

  public int size() {
    return entries.size();
  }

  private static boolean matchesFilter(Map<String, Object> metadata, Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return true;
    }
    return filter.entrySet().stream()
        .allMatch(f -> Objects.equals(metadata.get(f.getKey()), f.getValue()));
  }
}
