package com.flamingo.ai.scriptrag.embedding.codec;

import com.flamingo.ai.scriptrag.exception.EmbeddingDecodeException;
import com.flamingo.ai.scriptrag.exception.EmbeddingDecodeException.Reason;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-layout codec for stored embeddings.
 *
 * <p>Layout: a 4-byte little-endian unsigned dimension count followed by {@code dimension}
 * little-endian float32 values. An empty vector encodes to the bare zero header, but decoding a
 * zero dimension is rejected. Non-finite values pass through untouched.
 */
public final class BinaryEmbeddingCodec {

  public static final int HEADER_BYTES = Integer.BYTES;
  public static final int DEFAULT_MAX_DIMENSION = 10_000;

  private final int maxDimension;

  public BinaryEmbeddingCodec() {
    this(DEFAULT_MAX_DIMENSION);
  }

  public BinaryEmbeddingCodec(int maxDimension) {
    if (maxDimension <= 0) {
      throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
    }
    this.maxDimension = maxDimension;
  }

  public int getMaxDimension() {
    return maxDimension;
  }

  /**
   * Encodes a vector into its binary representation.
   *
   * @param vector the embedding (must not be null)
   * @return header plus packed float32 payload
   */
  public byte[] encode(float[] vector) {
    ByteBuffer bb =
        ByteBuffer.allocate(HEADER_BYTES + vector.length * Float.BYTES)
            .order(ByteOrder.LITTLE_ENDIAN);
    bb.putInt(vector.length);
    for (float v : vector) bb.putFloat(v);
    return bb.array();
  }

  /**
   * Decodes a binary payload back into a vector.
   *
   * @param data the payload
   * @return the decoded vector
   * @throws EmbeddingDecodeException if the payload is structurally invalid
   */
  public float[] decode(byte[] data) {
    if (data == null || data.length < HEADER_BYTES) {
      int length = data == null ? 0 : data.length;
      throw new EmbeddingDecodeException(
          Reason.TOO_SHORT,
          "Embedding data too short: expected at least " + HEADER_BYTES + " bytes, got " + length);
    }
    ByteBuffer bb = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    long dimension = Integer.toUnsignedLong(bb.getInt());

    if (dimension == 0) {
      throw new EmbeddingDecodeException(
          Reason.ZERO_DIMENSION, "Embedding dimension cannot be zero");
    }
    if (dimension > maxDimension) {
      throw new EmbeddingDecodeException(
          Reason.DIMENSION_TOO_LARGE,
          "Embedding dimension " + dimension + " exceeds maximum allowed " + maxDimension);
    }
    long expected = dimension * Float.BYTES;
    int remaining = data.length - HEADER_BYTES;
    if (remaining != expected) {
      throw new EmbeddingDecodeException(
          Reason.SIZE_MISMATCH,
          "Embedding data size mismatch: expected "
              + (HEADER_BYTES + expected)
              + " bytes, got "
              + data.length);
    }

    float[] out = new float[(int) dimension];
    for (int i = 0; i < out.length; i++) out[i] = bb.getFloat();
    return out;
  }
}
