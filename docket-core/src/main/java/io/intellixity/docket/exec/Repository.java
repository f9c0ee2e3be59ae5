package io.intellixity.docket.exec;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.value.DocumentId;

import java.util.Map;
import java.util.Optional;

/**
 * Mediates between documents of one type and their collection in the store.
 * <p>
 * Filters are store-native and passed through unchanged. Lifecycle misuse raises
 * {@link PreconditionViolationException}; store failures other than constraint violations propagate as
 * thrown by the driver.
 */
public interface Repository<T extends Document> {
  CollectionBinding<T> binding();

  default WriteResult insert(T doc) {
    return insert(doc, WriteOptions.defaults());
  }

  /** Writes a {@code NEW} document; on success it becomes {@code PERSISTED} with a store-assigned identity. */
  WriteResult insert(T doc, WriteOptions options);

  default WriteResult update(T doc) {
    return update(doc, WriteOptions.defaults());
  }

  /** Replaces the stored record of a {@code PERSISTED} document. */
  WriteResult update(T doc, WriteOptions options);

  default WriteResult save(T doc) {
    return save(doc, WriteOptions.defaults());
  }

  /** Inserts a {@code NEW} document, updates a {@code PERSISTED} one. */
  WriteResult save(T doc, WriteOptions options);

  /**
   * Deletes the record of a {@code PERSISTED} document and marks it {@code REMOVED}.
   *
   * @return whether the store reported a deleted record
   */
  boolean remove(T doc);

  /**
   * Re-reads the fields of a {@code PERSISTED} document.
   *
   * @return false if the record no longer exists (the document is left untouched)
   */
  boolean reload(T doc);

  Optional<T> findOne(Map<String, Object> filter);

  /** Sugar for a filter on the identity field. */
  Optional<T> findOne(DocumentId id);

  default Cursor<T> find() {
    return find(Map.of(), FindOptions.none());
  }

  default Cursor<T> find(Map<String, Object> filter) {
    return find(filter, FindOptions.none());
  }

  /** Returns a cursor without running the query. */
  Cursor<T> find(Map<String, Object> filter, FindOptions options);

  default long count() {
    return count(Map.of());
  }

  long count(Map<String, Object> filter);

  default boolean isEmpty() {
    return count() == 0;
  }
}
