package com.flamingo.ai.scriptrag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scriptrag.embedding.pipeline.EmbeddingPipeline;
import com.flamingo.ai.scriptrag.embedding.store.HybridVectorStore;
import com.flamingo.ai.scriptrag.embedding.store.VectorStore;
import com.flamingo.ai.scriptrag.search.SearchEngine;
import com.flamingo.ai.scriptrag.search.semantic.SemanticSearchAdapter;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The embedding model is mocked so no API key or
 * network access is needed.
 */
@SpringBootTest(
    properties = {
      "spring.datasource.url=jdbc:sqlite:target/context-test.db",
      "scriptrag.storage.root-path=target/context-test-embeddings"
    })
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Core search and embedding beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(SearchEngine.class)).isNotNull();
    assertThat(applicationContext.getBean(SemanticSearchAdapter.class)).isNotNull();
    assertThat(applicationContext.getBean(EmbeddingPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean(VectorStore.class)).isInstanceOf(HybridVectorStore.class);
  }
}
