package io.intellixity.docket.exec;

import io.intellixity.docket.document.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Lazy, forward-only view over query results.
 * <p>
 * The query runs on the first {@link #next()}; each call decodes one stored record. Once {@code next()}
 * has returned null the cursor stays exhausted; re-querying needs a new find.
 */
public interface Cursor<T extends Document> extends AutoCloseable {
  /** Next document (state {@code PERSISTED}), or null when exhausted or closed. */
  T next();

  boolean isExhausted();

  default void forEachRemaining(Consumer<? super T> action) {
    for (T d = next(); d != null; d = next()) action.accept(d);
  }

  /** Drains the remaining documents. */
  default List<T> toList() {
    List<T> out = new ArrayList<>();
    forEachRemaining(out::add);
    return out;
  }

  /** Releases the store cursor; idempotent. */
  @Override
  void close();
}
