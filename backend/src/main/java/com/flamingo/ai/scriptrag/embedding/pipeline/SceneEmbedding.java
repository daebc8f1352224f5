package com.flamingo.ai.scriptrag.embedding.pipeline;

/**
 * Embedding produced for one scene.
 *
 * @param sceneId the scene id
 * @param embedding the vector, or null when generation failed for this scene
 */
public record SceneEmbedding(long sceneId, float[] embedding) {

  public boolean isPresent() {
    return embedding != null;
  }
}
