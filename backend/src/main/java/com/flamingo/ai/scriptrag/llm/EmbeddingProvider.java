package com.flamingo.ai.scriptrag.llm;

/** Provider-side embedding call. Implementations may throw on transport or provider errors. */
public interface EmbeddingProvider {

  EmbeddingResponse embed(EmbeddingRequest request);
}
