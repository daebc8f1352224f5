package com.flamingo.ai.scriptrag.embedding.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.scriptrag.exception.VectorStorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HybridVectorStore Tests")
class HybridVectorStoreTest {

  private static final String MODEL = "m";

  private SimpleMeterRegistry meterRegistry;
  private InMemoryVectorStore primary;
  private InMemoryVectorStore secondary;
  private HybridVectorStore hybrid;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    primary = new InMemoryVectorStore();
    secondary = new InMemoryVectorStore();
    hybrid = new HybridVectorStore(primary, secondary, meterRegistry);
  }

  private double secondaryFailures() {
    return meterRegistry.find(HybridVectorStore.SECONDARY_FAILURE_METRIC).counters().stream()
        .mapToDouble(c -> c.count())
        .sum();
  }

  @Nested
  @DisplayName("store")
  class Store {

    @Test
    @DisplayName("Should write to both stores")
    void shouldWriteBoth() {
      hybrid.store("scene", 1L, new float[] {1f}, MODEL);

      assertThat(primary.exists("scene", 1L, MODEL)).isTrue();
      assertThat(secondary.exists("scene", 1L, MODEL)).isTrue();
    }

    @Test
    @DisplayName("Should swallow secondary write failures")
    void shouldSwallowSecondaryFailure() {
      VectorStore failing = mock(VectorStore.class);
      doThrow(new VectorStorageException("disk full"))
          .when(failing)
          .store(anyString(), anyLong(), any(), anyString(), any());
      HybridVectorStore store = new HybridVectorStore(primary, failing, meterRegistry);

      store.store("scene", 1L, new float[] {1f}, MODEL);

      assertThat(primary.exists("scene", 1L, MODEL)).isTrue();
      assertThat(secondaryFailures()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should propagate primary write failures and skip the secondary")
    void shouldPropagatePrimaryFailure() {
      VectorStore failing = mock(VectorStore.class);
      doThrow(new VectorStorageException("boom"))
          .when(failing)
          .store(anyString(), anyLong(), any(), anyString(), any());
      HybridVectorStore store = new HybridVectorStore(failing, secondary, meterRegistry);

      assertThatThrownBy(() -> store.store("scene", 1L, new float[] {1f}, MODEL))
          .isInstanceOf(VectorStorageException.class);
      assertThat(secondary.exists("scene", 1L, MODEL)).isFalse();
    }
  }

  @Nested
  @DisplayName("retrieve")
  class Retrieve {

    @Test
    @DisplayName("Should fall back to the secondary and restore the primary")
    void shouldWriteThroughToPrimary() {
      secondary.store("scene", 4L, new float[] {2f, 3f}, MODEL);

      assertThat(hybrid.retrieve("scene", 4L, MODEL))
          .hasValueSatisfying(v -> assertThat(v).containsExactly(2f, 3f));
      assertThat(primary.exists("scene", 4L, MODEL)).isTrue();
    }

    @Test
    @DisplayName("Should still return the secondary value when restoring the primary fails")
    void shouldReturnValueWhenRestoreFails() {
      VectorStore failingPrimary = mock(VectorStore.class);
      when(failingPrimary.retrieve("scene", 4L, MODEL)).thenReturn(Optional.empty());
      doThrow(new VectorStorageException("read-only"))
          .when(failingPrimary)
          .store(anyString(), anyLong(), any(), anyString(), any());
      secondary.store("scene", 4L, new float[] {2f}, MODEL);
      HybridVectorStore store = new HybridVectorStore(failingPrimary, secondary, meterRegistry);

      assertThat(store.retrieve("scene", 4L, MODEL)).isPresent();
      assertThat(secondaryFailures()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not consult the secondary on a primary hit")
    void shouldPreferPrimary() {
      VectorStore spySecondary = mock(VectorStore.class);
      primary.store("scene", 1L, new float[] {1f}, MODEL);
      HybridVectorStore store = new HybridVectorStore(primary, spySecondary, meterRegistry);

      assertThat(store.retrieve("scene", 1L, MODEL)).isPresent();
      verify(spySecondary, never()).retrieve(anyString(), anyLong(), anyString());
    }
  }

  @Nested
  @DisplayName("delete and exists")
  class DeleteAndExists {

    @Test
    @DisplayName("Should report true when either store held the entry")
    void shouldOrDeleteResults() {
      secondary.store("scene", 1L, new float[] {1f}, MODEL);
      assertThat(hybrid.delete("scene", 1L, MODEL)).isTrue();

      primary.store("scene", 2L, new float[] {1f}, MODEL);
      assertThat(hybrid.delete("scene", 2L, MODEL)).isTrue();

      assertThat(hybrid.delete("scene", 3L, MODEL)).isFalse();
    }

    @Test
    @DisplayName("Should ignore secondary delete failures")
    void shouldIgnoreSecondaryDeleteFailure() {
      VectorStore failing = mock(VectorStore.class);
      when(failing.delete(anyString(), anyLong(), eq(MODEL)))
          .thenThrow(new VectorStorageException("io"));
      primary.store("scene", 1L, new float[] {1f}, MODEL);
      HybridVectorStore store = new HybridVectorStore(primary, failing, meterRegistry);

      assertThat(store.delete("scene", 1L, MODEL)).isTrue();
      assertThat(store.delete("scene", 1L, MODEL)).isFalse();
    }

    @Test
    @DisplayName("Should find entries held only by the secondary")
    void shouldCheckSecondaryForExists() {
      secondary.store("scene", 8L, new float[] {1f}, MODEL);

      assertThat(hybrid.exists("scene", 8L, MODEL)).isTrue();
      assertThat(hybrid.exists("scene", 9L, MODEL)).isFalse();
    }
  }

  @Test
  @DisplayName("Should search only the primary")
  void shouldSearchPrimaryOnly() {
    secondary.store("scene", 1L, new float[] {1f, 0f}, MODEL);
    primary.store("scene", 2L, new float[] {1f, 0f}, MODEL);

    assertThat(hybrid.supportsSearch()).isTrue();
    assertThat(hybrid.search(new float[] {1f, 0f}, "scene", MODEL, 5, null, null))
        .extracting(VectorMatch::entityId)
        .containsExactly(2L);
  }

  @Test
  @DisplayName("Should work without a secondary")
  void shouldWorkWithoutSecondary() {
    HybridVectorStore store = new HybridVectorStore(primary, null, meterRegistry);
    store.store("scene", 1L, new float[] {1f}, MODEL);

    assertThat(store.getSecondary()).isEmpty();
    assertThat(store.retrieve("scene", 2L, MODEL)).isEmpty();
    assertThat(store.delete("scene", 1L, MODEL)).isTrue();
  }
}
