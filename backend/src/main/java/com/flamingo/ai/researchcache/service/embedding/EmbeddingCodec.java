package com.flamingo.ai.researchcache.service.embedding;

import com.flamingo.ai.researchcache.exception.DimensionMismatchException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Packs vectors as consecutive 4-byte floats in native byte order, without a length prefix. The
 * reader must know the dimension from the model catalog.
 */
public final class EmbeddingCodec {

  private static final int FLOAT_BYTES = Float.BYTES;

  private EmbeddingCodec() {}

  public static byte[] serialize(float[] vector) {
    ByteBuffer buffer =
        ByteBuffer.allocate(vector.length * FLOAT_BYTES).order(ByteOrder.nativeOrder());
    buffer.asFloatBuffer().put(vector);
    return buffer.array();
  }

  /**
   * Decodes a stored vector.
   *
   * @throws DimensionMismatchException if {@code data} does not hold exactly {@code dimension}
   *     floats
   */
  public static float[] deserialize(byte[] data, int dimension) {
    return deserialize(data, dimension, "stored vector");
  }

  /** {@link #deserialize(byte[], int)} naming {@code context} in the mismatch message. */
  public static float[] deserialize(byte[] data, int dimension, String context) {
    if (data == null || data.length != dimension * FLOAT_BYTES) {
      int actual = data == null ? 0 : data.length / FLOAT_BYTES;
      throw new DimensionMismatchException(dimension, actual, context);
    }
    float[] vector = new float[dimension];
    ByteBuffer.wrap(data).order(ByteOrder.nativeOrder()).asFloatBuffer().get(vector);
    return vector;
  }

  /** Number of floats encoded in {@code data}. */
  public static int dimensionOf(byte[] data) {
    if (data.length % FLOAT_BYTES != 0) {
      throw new IllegalArgumentException(
          "Encoded vector length " + data.length + " is not a multiple of " + FLOAT_BYTES);
    }
    return data.length / FLOAT_BYTES;
  }
}
