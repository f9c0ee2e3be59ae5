package io.intellixity.docket.exec.handle;

/**
 * Resolved connection to a document store.
 * <p>
 * Example: for Mongo, {@code client()} is the MongoClient and {@code namespace()} the database.
 */
public interface StoreHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by the store binding. */
  TClient client();

  /** Database (or equivalent) that collections are resolved in. */
  String namespace();
}
