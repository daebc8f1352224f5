package com.flamingo.ai.scriptrag.embedding.store;

import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Copies persisted vectors and their metadata from the file store into a searchable store. */
@Slf4j
public class VectorStoreWarmup {

  private final FileVectorStore source;
  private final VectorStore target;

  public VectorStoreWarmup(FileVectorStore source, VectorStore target) {
    this.source = source;
    this.target = target;
  }

  /**
   * Loads every stored vector of one entity type and model.
   *
   * @return number of vectors loaded; unreadable entries are skipped
   */
  public int load(String entityType, String model) {
    int loaded = 0;
    for (long id : source.listEntityIds(entityType, model)) {
      Optional<float[]> vector = source.retrieve(entityType, id, model);
      if (vector.isEmpty()) {
        continue;
      }
      Map<String, Object> metadata = source.readMetadata(entityType, id, model);
      target.store(entityType, id, vector.get(), model, metadata);
      loaded++;
    }
    log.info("Loaded {} {} embeddings for model {}", loaded, entityType, model);
    return loaded;
  }
}
