package com.flamingo.ai.scriptrag.embedding.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.scriptrag.embedding.codec.BinaryEmbeddingCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("VectorStoreWarmup Tests")
class VectorStoreWarmupTest {

  @TempDir Path root;

  @Test
  @DisplayName("Should load persisted vectors with metadata and skip corrupted ones")
  void shouldLoadPersistedVectors() throws IOException {
    FileVectorStore files =
        new FileVectorStore(root, new BinaryEmbeddingCodec(), new ObjectMapper());
    files.store("scene", 1L, new float[] {1f, 0f}, "m", Map.of("content", "kitchen"));
    files.store("scene", 2L, new float[] {0f, 1f}, "m");
    files.store("scene", 3L, new float[] {0f, 1f}, "m");
    Files.write(files.getEmbeddingPath("scene", 3L, "m"), new byte[] {1});
    InMemoryVectorStore memory = new InMemoryVectorStore();

    int loaded = new VectorStoreWarmup(files, memory).load("scene", "m");

    assertThat(loaded).isEqualTo(2);
    assertThat(memory.search(new float[] {1f, 0f}, "scene", "m", 1, null, null))
        .singleElement()
        .satisfies(
            match -> {
              assertThat(match.entityId()).isEqualTo(1L);
              assertThat(match.metadata()).containsEntry("content", "kitchen");
            });
  }
}
