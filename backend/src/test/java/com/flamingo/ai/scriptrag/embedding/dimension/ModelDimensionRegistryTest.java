package com.flamingo.ai.scriptrag.embedding.dimension;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ModelDimensionRegistry Tests")
class ModelDimensionRegistryTest {

  private final ModelDimensionRegistry registry = new ModelDimensionRegistry();

  @Test
  @DisplayName("Should know default dimensions of common models")
  void shouldKnowDefaults() {
    assertThat(registry.getDimensions("text-embedding-3-small")).hasValue(1536);
    assertThat(registry.getDimensions("text-embedding-3-large")).hasValue(3072);
    assertThat(registry.getDimensions("all-MiniLM-L6-v2")).hasValue(384);
    assertThat(registry.getDimensions("unknown-model")).isEmpty();
  }

  @Test
  @DisplayName("Should validate custom dimensions against model bounds")
  void shouldValidateCustomDimensions() {
    assertThat(registry.validateDimensions("text-embedding-3-small", 512)).isEmpty();
    assertThat(registry.validateDimensions("text-embedding-3-small", 100)).isPresent();
    assertThat(registry.validateDimensions("text-embedding-3-small", 4096)).isPresent();
    assertThat(registry.validateDimensions("text-embedding-ada-002", 512)).isPresent();
    assertThat(registry.validateDimensions("text-embedding-ada-002", 1536)).isEmpty();
    assertThat(registry.validateDimensions("unknown-model", 7)).isEmpty();
  }

  @Test
  @DisplayName("Should validate embeddings for emptiness, finiteness and length")
  void shouldValidateEmbeddings() {
    assertThat(registry.validateEmbedding(new float[0], null)).isPresent();
    assertThat(registry.validateEmbedding(new float[] {Float.NaN}, null)).isPresent();
    assertThat(registry.validateEmbedding(new float[] {1f, 2f}, "bge-small-en"))
        .hasValueSatisfying(msg -> assertThat(msg).contains("expected 384"));
    assertThat(registry.validateEmbedding(new float[384], "bge-small-en")).isEmpty();
  }

  @Test
  @DisplayName("Should accept custom registrations")
  void shouldRegisterCustomModel() {
    registry.register(ModelInfo.fixed("local-model", 64));

    assertThat(registry.hasModel("local-model")).isTrue();
    assertThat(registry.getDimensions("local-model")).hasValue(64);
    assertThat(registry.getAllModels()).extracting(ModelInfo::name).contains("local-model");
  }
}
