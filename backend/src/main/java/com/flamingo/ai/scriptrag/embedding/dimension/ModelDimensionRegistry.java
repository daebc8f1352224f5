package com.flamingo.ai.scriptrag.embedding.dimension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/** Lookup of expected embedding dimensions by model name. */
@Slf4j
public class ModelDimensionRegistry {

  private final Map<String, ModelInfo> models = new ConcurrentHashMap<>();

  public ModelDimensionRegistry() {
    register(new ModelInfo("text-embedding-3-small", 1536, 8191, true, 256, 1536));
    register(new ModelInfo("text-embedding-3-large", 3072, 8191, true, 256, 3072));
    register(new ModelInfo("text-embedding-ada-002", 1536, 8191, false, null, null));
    register(ModelInfo.fixed("embed-english-v3.0", 1024));
    register(ModelInfo.fixed("embed-multilingual-v3.0", 1024));
    register(ModelInfo.fixed("embed-english-light-v3.0", 384));
    register(ModelInfo.fixed("all-MiniLM-L6-v2", 384));
    register(ModelInfo.fixed("all-mpnet-base-v2", 768));
    register(ModelInfo.fixed("e5-small-v2", 384));
    register(ModelInfo.fixed("e5-base-v2", 768));
    register(ModelInfo.fixed("e5-large-v2", 1024));
    register(ModelInfo.fixed("bge-small-en", 384));
    register(ModelInfo.fixed("bge-base-en", 768));
    register(ModelInfo.fixed("bge-large-en", 1024));
  }

  public void register(ModelInfo info) {
    models.put(info.name(), info);
    log.debug("Registered model: {} ({}D)", info.name(), info.dimensions());
  }

  public boolean hasModel(String model) {
    return models.containsKey(model);
  }

  public Optional<ModelInfo> getModelInfo(String model) {
    return Optional.ofNullable(models.get(model));
  }

  /** Default dimensions for a model, empty if the model is unknown. */
  public OptionalInt getDimensions(String model) {
    ModelInfo info = models.get(model);
    return info == null ? OptionalInt.empty() : OptionalInt.of(info.dimensions());
  }

  /**
   * Checks a requested output size against what the model accepts. Unknown models always pass.
   *
   * @return empty if valid, otherwise the reason it is not
   */
  public Optional<String> validateDimensions(String model, int dimensions) {
    ModelInfo info = models.get(model);
    if (info == null) {
      return Optional.empty();
    }
    if (!info.supportsCustomDimensions()) {
      return dimensions == info.dimensions()
          ? Optional.empty()
          : Optional.of(
              "Model " + model + " requires exactly " + info.dimensions() + " dimensions");
    }
    if (info.minCustomDimensions() != null && dimensions < info.minCustomDimensions()) {
      return Optional.of(
          "Model " + model + " requires at least " + info.minCustomDimensions() + " dimensions");
    }
    if (info.maxCustomDimensions() != null && dimensions > info.maxCustomDimensions()) {
      return Optional.of(
          "Model " + model + " supports at most " + info.maxCustomDimensions() + " dimensions");
    }
    return Optional.empty();
  }

  /**
   * Checks that a vector is non-empty, finite and, for known models, of the expected length.
   *
   * @return empty if valid, otherwise the reason it is not
   */
  public Optional<String> validateEmbedding(float[] vector, String model) {
    if (vector == null || vector.length == 0) {
      return Optional.of("Empty vector");
    }
    for (float v : vector) {
      if (!Float.isFinite(v)) {
        return Optional.of("Vector contains NaN or Inf values");
      }
    }
    OptionalInt expected = model == null ? OptionalInt.empty() : getDimensions(model);
    if (expected.isPresent() && expected.getAsInt() != vector.length) {
      return Optional.of(
          "Dimension mismatch: expected "
              + expected.getAsInt()
              + ", got "
              + vector.length
              + " for model "
              + model);
    }
    return Optional.empty();
  }

  public List<ModelInfo> getAllModels() {
    return new ArrayList<>(models.values());
  }
}
