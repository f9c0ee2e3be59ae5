package io.intellixity.docket.document;

/** Lifecycle state of a {@link Document}. */
public enum DocumentState {
  /** Constructed in memory, never written; carries no identity. */
  NEW,
  /** Backed by a live record; identity assigned. */
  PERSISTED,
  /** Terminal: the backing record was removed. Identity is retained. */
  REMOVED
}
