package io.intellixity.sqlbridge.spi.backend;

import io.intellixity.sqlbridge.value.Value;

/**
 * Converts between {@link Value} and a backend's native cell representation.\n
 *
 * Decoding must be total over the types the backend can produce; a native value with no
 * {@link Value} counterpart is reported as {@link io.intellixity.sqlbridge.error.CodecException}.\n
 */
public interface ValueCodec<N> {
  N encode(Value value);

  /** {@code columnIndex} is 0-based and only used for error reporting. */
  Value decode(N nativeValue, int columnIndex);
}
