package io.intellixity.docket.exec;

import io.intellixity.docket.value.DocumentId;

/**
 * The store rejected a write because of a constraint it enforces (typically a unique index).
 * The driver's native exception is kept as the cause.
 */
public class ConstraintViolationException extends RuntimeException {
  private final String operation;
  private final String collection;
  private final DocumentId documentId;

  public ConstraintViolationException(String operation, String collection, DocumentId documentId, Throwable cause) {
    super(operation + " on '" + collection + "'" + (documentId == null ? "" : " (id=" + documentId + ")")
        + " violated a store constraint" + (cause == null ? "" : ": " + cause.getMessage()), cause);
    this.operation = operation;
    this.collection = collection;
    this.documentId = documentId;
  }

  public String operation() { return operation; }
  public String collection() { return collection; }

  /** Identity of the document being written, or null for inserts. */
  public DocumentId documentId() { return documentId; }
}
