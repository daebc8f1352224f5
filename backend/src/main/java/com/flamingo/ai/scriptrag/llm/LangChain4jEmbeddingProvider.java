package com.flamingo.ai.scriptrag.llm;

import com.flamingo.ai.scriptrag.exception.EmbeddingGenerationException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String configuredModel;

  @Override
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public EmbeddingResponse embed(EmbeddingRequest request) {
    if (configuredModel != null && !configuredModel.equals(request.model())) {
      log.warn(
          "Requested embedding model {} but the provider is bound to {}",
          request.model(),
          configuredModel);
    }
    log.debug("Calling embedding API for {} inputs", request.input().size());

    List<TextSegment> segments = request.input().stream().map(TextSegment::from).toList();
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);

    List<EmbeddingResponse.EmbeddingData> data = new ArrayList<>();
    List<Embedding> embeddings = response.content() == null ? List.of() : response.content();
    for (int i = 0; i < embeddings.size(); i++) {
      data.add(new EmbeddingResponse.EmbeddingData(i, embeddings.get(i).vector()));
    }
    meterRegistry.counter("embedding.requests.success").increment();

    return new EmbeddingResponse(
        configuredModel != null ? configuredModel : request.model(),
        data,
        toUsage(response.tokenUsage()));
  }

  private EmbeddingResponse.Usage toUsage(TokenUsage tokenUsage) {
    if (tokenUsage == null) {
      return null;
    }
    int input = tokenUsage.inputTokenCount() == null ? 0 : tokenUsage.inputTokenCount();
    int total = tokenUsage.totalTokenCount() == null ? input : tokenUsage.totalTokenCount();
    return new EmbeddingResponse.Usage(input, total);
  }

  @SuppressWarnings("unused")
  private EmbeddingResponse embedFallback(EmbeddingRequest request, Throwable t) {
    log.error(
        "Embedding failed for {} inputs, circuit breaker open: {}",
        request.input().size(),
        t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    throw new EmbeddingGenerationException("Embedding provider call failed: " + t.getMessage(), t);
  }
}
