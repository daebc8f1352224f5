package com.flamingo.ai.scriptrag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.scriptrag.embedding.batch.BatchProcessor;
import com.flamingo.ai.scriptrag.embedding.batch.ChunkingBatchProcessor;
import com.flamingo.ai.scriptrag.embedding.cache.EmbeddingCache;
import com.flamingo.ai.scriptrag.embedding.codec.BinaryEmbeddingCodec;
import com.flamingo.ai.scriptrag.embedding.dimension.ModelDimensionRegistry;
import com.flamingo.ai.scriptrag.embedding.pipeline.EmbeddingPipeline;
import com.flamingo.ai.scriptrag.embedding.preprocess.StandardPreprocessor;
import com.flamingo.ai.scriptrag.embedding.store.FileVectorStore;
import com.flamingo.ai.scriptrag.embedding.store.HybridVectorStore;
import com.flamingo.ai.scriptrag.embedding.store.InMemoryVectorStore;
import com.flamingo.ai.scriptrag.embedding.store.VectorStoreWarmup;
import com.flamingo.ai.scriptrag.llm.EmbeddingProvider;
import com.flamingo.ai.scriptrag.search.semantic.VectorSemanticSearchAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Paths;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/** Wires codec, vector stores and the embedding pipeline from {@link ScriptragProperties}. */
@Configuration
@Slf4j
public class EmbeddingConfig {

  @Bean
  public BinaryEmbeddingCodec binaryEmbeddingCodec(ScriptragProperties properties) {
    return new BinaryEmbeddingCodec(properties.getStorage().getMaxDimension());
  }

  @Bean
  public ModelDimensionRegistry modelDimensionRegistry() {
    return new ModelDimensionRegistry();
  }

  @Bean
  public FileVectorStore fileVectorStore(
      ScriptragProperties properties, BinaryEmbeddingCodec codec, ObjectMapper objectMapper) {
    ScriptragProperties.Storage storage = properties.getStorage();
    return new FileVectorStore(
        Paths.get(storage.getRootPath()),
        storage.getExtension(),
        storage.getMarkerFileName(),
        codec,
        objectMapper);
  }

  @Bean
  public InMemoryVectorStore inMemoryVectorStore() {
    return new InMemoryVectorStore();
  }

  @Bean
  @Primary
  public HybridVectorStore hybridVectorStore(
      ScriptragProperties properties,
      InMemoryVectorStore inMemoryVectorStore,
      FileVectorStore fileVectorStore,
      MeterRegistry meterRegistry) {
    boolean secondaryEnabled = properties.getStorage().isSecondaryEnabled();
    log.info(
        "Vector store: in-memory primary, file secondary {}",
        secondaryEnabled ? "enabled at " + properties.getStorage().getRootPath() : "disabled");
    return new HybridVectorStore(
        inMemoryVectorStore, secondaryEnabled ? fileVectorStore : null, meterRegistry);
  }

  @Bean
  public BatchProcessor batchProcessor(
      ScriptragProperties properties,
      EmbeddingProvider embeddingProvider,
      @Qualifier("embeddingBatchExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    ScriptragProperties.Embedding embedding = properties.getEmbedding();
    if (embedding.getChunkSize() > 0) {
      return new ChunkingBatchProcessor(
          embeddingProvider,
          embedding.getBatchSize(),
          executor,
          meterRegistry,
          embedding.getChunkSize(),
          embedding.getChunkOverlap());
    }
    return new BatchProcessor(embeddingProvider, embedding.getBatchSize(), executor, meterRegistry);
  }

  @Bean
  public EmbeddingPipeline embeddingPipeline(
      ScriptragProperties properties,
      BatchProcessor batchProcessor,
      ModelDimensionRegistry modelDimensionRegistry,
      MeterRegistry meterRegistry) {
    ScriptragProperties.Embedding embedding = properties.getEmbedding();
    ScriptragProperties.Cache cacheProperties = properties.getCache();

    if (embedding.getDimensions() != null) {
      modelDimensionRegistry
          .validateDimensions(embedding.getModel(), embedding.getDimensions())
          .ifPresent(
              error -> {
                throw new IllegalStateException("Invalid embedding configuration: " + error);
              });
    }

    EmbeddingCache cache =
        embedding.isUseCache()
            ? new EmbeddingCache(
                cacheProperties.getStrategy(),
                cacheProperties.getMaxSize(),
                cacheProperties.getTtl())
            : null;
    return new EmbeddingPipeline(
        embedding.getModel(),
        embedding.getDimensions(),
        embedding.getMaxTextLength(),
        new StandardPreprocessor(embedding.getPreprocessingSteps(), embedding.getMaxTextLength()),
        batchProcessor,
        cache,
        modelDimensionRegistry,
        meterRegistry);
  }

  @Bean
  public ApplicationRunner vectorStoreWarmup(
      ScriptragProperties properties,
      FileVectorStore fileVectorStore,
      InMemoryVectorStore inMemoryVectorStore) {
    return args -> {
      if (!properties.getStorage().isSecondaryEnabled()) {
        return;
      }
      VectorStoreWarmup warmup = new VectorStoreWarmup(fileVectorStore, inMemoryVectorStore);
      String model = properties.getEmbedding().getModel();
      warmup.load(VectorSemanticSearchAdapter.SCENE_ENTITY, model);
      warmup.load(VectorSemanticSearchAdapter.BIBLE_CHUNK_ENTITY, model);
    };
  }
}
