package io.intellixity.docket.observer;

import io.intellixity.docket.document.Document;

/**
 * Receives lifecycle callbacks around persistence operations on documents of type {@code T}.
 * <p>
 * Every hook defaults to a no-op; implementations override the ones they need. A hook that throws
 * aborts the remaining observers and the enclosing operation.
 * <p>
 * Observers that write through a repository of the same type re-enter dispatch; nothing guards
 * against the resulting recursion.
 */
public interface DocumentObserver<T extends Document> {
  default void beforeValidate(T doc) {}

  default void afterValidate(T doc) {}

  default void beforeInsert(T doc) {}

  default void beforeUpdate(T doc) {}

  /** Fires before either an insert or an update, after the specific before-hook. */
  default void beforeInsertOrUpdate(T doc) {}

  default void afterInsert(T doc) {}

  default void afterUpdate(T doc) {}

  /** Fires after either an insert or an update, after the specific after-hook. */
  default void afterInsertOrUpdate(T doc) {}

  default void beforeRemove(T doc) {}

  default void afterRemove(T doc) {}
}
