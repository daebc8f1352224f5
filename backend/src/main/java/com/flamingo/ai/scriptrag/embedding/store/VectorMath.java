package com.flamingo.ai.scriptrag.embedding.store;

/** Similarity and distance helpers over float vectors. */
public final class VectorMath {
  private VectorMath() {}

  /**
   * Cosine similarity in {@code [-1, 1]}. Returns 0 when either vector has zero norm.
   *
   * @throws IllegalArgumentException if the vectors differ in length
   */
  public static double cosineSimilarity(float[] a, float[] b) {
    checkSameLength(a, b);
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  public static double dotProduct(float[] a, float[] b) {
    checkSameLength(a, b);
    double dot = 0;
    for (int i = 0; i < a.length; i++) dot += (double) a[i] * b[i];
    return dot;
  }

  public static double euclideanDistance(float[] a, float[] b) {
    checkSameLength(a, b);
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      double d = (double) a[i] - b[i];
      sum += d * d;
    }
    return Math.sqrt(sum);
  }

  /** Returns a unit-length copy of {@code v}, or a plain copy if {@code v} has zero norm. */
  public static float[] normalize(float[] v) {
    double norm = 0;
    for (float f : v) norm += (double) f * f;
    float[] out = v.clone();
    if (norm == 0) {
      return out;
    }
    double inv = 1.0 / Math.sqrt(norm);
    for (int i = 0; i < out.length; i++) out[i] = (float) (out[i] * inv);
    return out;
  }

  private static void checkSameLength(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
  }
}
