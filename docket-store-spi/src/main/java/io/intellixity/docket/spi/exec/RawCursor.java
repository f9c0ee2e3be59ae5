package io.intellixity.docket.spi.exec;

import java.util.Map;

/**
 * Store-native result iterator. Records are raw maps in the shape produced by the store binding
 * (identity under {@code _id}).
 */
public interface RawCursor extends AutoCloseable {
  boolean hasNext();

  /** Next raw record; only valid after {@link #hasNext()} returned true. */
  Map<String, Object> next();

  @Override
  void close();
}
