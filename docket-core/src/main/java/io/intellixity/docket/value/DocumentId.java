package io.intellixity.docket.value;

import java.util.Objects;

/**
 * Store-assigned identity of a persisted document.
 * <p>
 * The wrapped value is whatever the store driver natively uses (an ObjectId for Mongo, a String for the
 * in-memory store) and is handed back to the driver untouched when filtering by identity.
 */
public record DocumentId(Object value) {
  public DocumentId {
    Objects.requireNonNull(value, "value");
    if (value instanceof DocumentId) throw new IllegalArgumentException("DocumentId cannot wrap another DocumentId");
  }

  public static DocumentId of(Object value) {
    if (value instanceof DocumentId id) return id;
    return new DocumentId(value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
