package com.flamingo.ai.scriptrag.embedding.store;

import com.flamingo.ai.scriptrag.exception.UnsupportedSearchException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage backend for embedding vectors keyed by {@code (entityType, entityId, model)}.
 *
 * <p>Similarity search is an optional capability: implementations that can rank vectors override
 * both {@link #supportsSearch()} and {@link #search}. Callers should check {@link
 * #supportsSearch()} before searching rather than relying on the exception.
 */
public interface VectorStore {

  /**
   * Stores a vector, replacing any previous vector under the same key.
   *
   * @param entityType type of entity, e.g. {@code scene} or {@code bible_chunk}
   * @param entityId id of the entity
   * @param vector the embedding
   * @param model model that produced the embedding
   * @param metadata optional metadata stored alongside the vector, may be null
   */
  void store(
      String entityType, long entityId, float[] vector, String model, Map<String, Object> metadata);

  default void store(String entityType, long entityId, float[] vector, String model) {
    store(entityType, entityId, vector, model, null);
  }

  Optional<float[]> retrieve(String entityType, long entityId, String model);

  /**
   * Deletes stored vectors for an entity.
   *
   * @param model the model to delete, or null to delete the entity's vectors for every model
   * @return true if anything was removed
   */
  boolean delete(String entityType, long entityId, String model);

  boolean exists(String entityType, long entityId, String model);

  /** Whether {@link #search} is implemented by this store. */
  default boolean supportsSearch() {
    return false;
  }

  /**
   * Ranks stored vectors of one entity type and model by similarity to {@code queryVector}.
   *
   * @param threshold minimum similarity, or null for no threshold
   * @param filter metadata entries a match must carry, or null
   * @return matches ordered by descending score
   * @throws UnsupportedSearchException if the store has no similarity index
   */
  default List<VectorMatch> search(
      float[] queryVector,
      String entityType,
      String model,
      int limit,
      Double threshold,
      Map<String, Object> filter) {
    throw new UnsupportedSearchException(getClass().getSimpleName());
  }
}
