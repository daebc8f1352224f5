package com.flamingo.ai.scriptrag.embedding.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.scriptrag.exception.EmbeddingDecodeException;
import com.flamingo.ai.scriptrag.exception.EmbeddingDecodeException.Reason;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BinaryEmbeddingCodec Tests")
class BinaryEmbeddingCodecTest {

  private final BinaryEmbeddingCodec codec = new BinaryEmbeddingCodec();

  @Nested
  @DisplayName("encode")
  class Encode {

    @Test
    @DisplayName("Should write a little-endian header followed by float32 values")
    void shouldWriteHeaderAndPayload() {
      byte[] bytes = codec.encode(new float[] {0.1f, 0.2f, 0.3f, 0.4f});

      assertThat(bytes).hasSize(20);
      ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
      assertThat(bb.getInt()).isEqualTo(4);
      assertThat(bb.getFloat()).isEqualTo(0.1f);
      assertThat(bytes[0]).isEqualTo((byte) 4);
      assertThat(bytes[3]).isEqualTo((byte) 0);
    }

    @Test
    @DisplayName("Should encode an empty vector as a bare zero header")
    void shouldEncodeEmptyVector() {
      assertThat(codec.encode(new float[0])).containsExactly(0, 0, 0, 0);
    }
  }

  @Nested
  @DisplayName("decode")
  class Decode {

    @Test
    @DisplayName("Should restore the encoded vector")
    void shouldRestoreEncodedVector() {
      float[] decoded = codec.decode(codec.encode(new float[] {0.1f, 0.2f, 0.3f, 0.4f}));

      assertThat(decoded).hasSize(4);
      assertThat(decoded[0]).isCloseTo(0.1f, within(1e-6f));
      assertThat(decoded[3]).isCloseTo(0.4f, within(1e-6f));
    }

    @Test
    @DisplayName("Should pass non-finite values through untouched")
    void shouldPassNonFiniteValues() {
      float[] decoded =
          codec.decode(
              codec.encode(new float[] {Float.NaN, Float.POSITIVE_INFINITY, -0.0f}));

      assertThat(Float.isNaN(decoded[0])).isTrue();
      assertThat(decoded[1]).isEqualTo(Float.POSITIVE_INFINITY);
      assertThat(Float.floatToRawIntBits(decoded[2])).isEqualTo(Float.floatToRawIntBits(-0.0f));
    }

    @Test
    @DisplayName("Should reject an empty vector payload as zero dimension")
    void shouldRejectZeroDimension() {
      assertThatThrownBy(() -> codec.decode(codec.encode(new float[0])))
          .isInstanceOf(EmbeddingDecodeException.class)
          .extracting(e -> ((EmbeddingDecodeException) e).getReason())
          .isEqualTo(Reason.ZERO_DIMENSION);
    }

    @Test
    @DisplayName("Should reject payloads shorter than the header")
    void shouldRejectTooShort() {
      assertThatThrownBy(() -> codec.decode(new byte[] {1, 0, 0}))
          .isInstanceOf(EmbeddingDecodeException.class)
          .extracting(e -> ((EmbeddingDecodeException) e).getReason())
          .isEqualTo(Reason.TOO_SHORT);
      assertThatThrownBy(() -> codec.decode(null))
          .isInstanceOf(EmbeddingDecodeException.class)
          .extracting(e -> ((EmbeddingDecodeException) e).getReason())
          .isEqualTo(Reason.TOO_SHORT);
    }

    @Test
    @DisplayName("Should reject a header that disagrees with the payload length")
    void shouldRejectSizeMismatch() {
      byte[] bytes = codec.encode(new float[] {1f, 2f, 3f});
      byte[] truncated = new byte[bytes.length - 2];
      System.arraycopy(bytes, 0, truncated, 0, truncated.length);

      assertThatThrownBy(() -> codec.decode(truncated))
          .isInstanceOf(EmbeddingDecodeException.class)
          .extracting(e -> ((EmbeddingDecodeException) e).getReason())
          .isEqualTo(Reason.SIZE_MISMATCH);
    }

    @Test
    @DisplayName("Should reject dimensions above the configured cap")
    void shouldRejectDimensionTooLarge() {
      BinaryEmbeddingCodec small = new BinaryEmbeddingCodec(2);

      assertThatThrownBy(() -> small.decode(small.encode(new float[] {1f, 2f, 3f})))
          .isInstanceOf(EmbeddingDecodeException.class)
          .extracting(e -> ((EmbeddingDecodeException) e).getReason())
          .isEqualTo(Reason.DIMENSION_TOO_LARGE);
    }

    @Test
    @DisplayName("Should treat the header as unsigned")
    void shouldTreatHeaderAsUnsigned() {
      byte[] bytes = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, 0};

      assertThatThrownBy(() -> codec.decode(bytes))
          .isInstanceOf(EmbeddingDecodeException.class)
          .extracting(e -> ((EmbeddingDecodeException) e).getReason())
          .isEqualTo(Reason.DIMENSION_TOO_LARGE);
    }
  }
}
