package com.databricks.batcher;

import java.nio.ByteBuffer;
import java.util.function.ToLongFunction;
import javax.annotation.Nonnull;

/**
 * Common size functions for {@link Batcher}.
 *
 * <p>Bulk endpoints usually cap requests by payload bytes. {@link #utf8Length()} and {@link
 * #byteArrayLength()} measure records the way such limits are enforced.
 */
public final class RecordSizes {

  private RecordSizes() {}

  /** Counts every record as size 1, so only the record count limit matters. */
  @Nonnull
  public static <T> ToLongFunction<T> one() {
    return record -> 1L;
  }

  /**
   * Counts every record as the given size.
   *
   * @param size the size of each record, must not be negative
   * @throws IllegalArgumentException if size is negative
   */
  @Nonnull
  public static <T> ToLongFunction<T> constant(long size) {
    if (size < 0) {
      throw new IllegalArgumentException("size cannot be negative");
    }
    return record -> size;
  }

  /** Measures byte arrays by their length. */
  @Nonnull
  public static ToLongFunction<byte[]> byteArrayLength() {
    return bytes -> bytes.length;
  }

  /** Measures byte buffers by their remaining bytes. */
  @Nonnull
  public static ToLongFunction<ByteBuffer> byteBufferRemaining() {
    return ByteBuffer::remaining;
  }

  /** Measures character sequences by their number of UTF-16 chars. */
  @Nonnull
  public static ToLongFunction<CharSequence> stringLength() {
    return CharSequence::length;
  }

  /** Measures character sequences by the number of bytes of their UTF-8 encoding. */
  @Nonnull
  public static ToLongFunction<CharSequence> utf8Length() {
    return RecordSizes::utf8Length;
  }

  static long utf8Length(CharSequence text) {
    long bytes = 0;
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < length
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else {
        // Unpaired surrogates are encoded as '?'.
        bytes += Character.isSurrogate(c) ? 1 : 3;
      }
    }
    return bytes;
  }
}
