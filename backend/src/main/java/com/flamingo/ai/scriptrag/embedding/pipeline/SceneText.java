package com.flamingo.ai.scriptrag.embedding.pipeline;

/** Scene input for {@link EmbeddingPipeline#generateForScenes}. */
public record SceneText(long id, String heading, String content) {

  String toEmbeddingText() {
    return "Scene: " + heading + "\n\n" + content;
  }
}
