package io.intellixity.docket.spi.memory;

/** A write would have produced two records with the same value for a unique field. */
public final class DuplicateKeyException extends RuntimeException {
  private final String collection;
  private final String field;
  private final Object key;

  public DuplicateKeyException(String collection, String field, Object key) {
    super("Duplicate key in '" + collection + "' for " + field + ": " + key);
    this.collection = collection;
    this.field = field;
    this.key = key;
  }

  public String collection() { return collection; }
  public String field() { return field; }
  public Object key() { return key; }
}
