package io.intellixity.docket.exec;

import io.intellixity.docket.validation.ErrorCollector;
import io.intellixity.docket.value.DocumentId;

import java.util.Objects;

/**
 * Outcome of an insert, update or save.
 * <p>
 * Recoverable failures are values; callers decide which of them are fatal:
 * {@link #strict()} escalates only constraint violations, {@link #orThrow()} escalates every failure.
 */
public sealed interface WriteResult {
  boolean isSuccess();

  /**
   * Returns this result unless it is a {@link ConstraintViolated}, in which case the store's violation is
   * thrown. Validation failures are still returned as values.
   */
  WriteResult strict();

  /** Returns the written identity or throws the failure this result carries. */
  DocumentId orThrow();

  record Success(DocumentId documentId) implements WriteResult {
    public Success {
      Objects.requireNonNull(documentId, "documentId");
    }

    @Override public boolean isSuccess() { return true; }
    @Override public WriteResult strict() { return this; }
    @Override public DocumentId orThrow() { return documentId; }
  }

  /** Validation did not pass; the document's errors are populated and nothing was written. */
  record Invalid(ErrorCollector errors) implements WriteResult {
    public Invalid {
      Objects.requireNonNull(errors, "errors");
    }

    @Override public boolean isSuccess() { return false; }
    @Override public WriteResult strict() { return this; }

    @Override
    public DocumentId orThrow() {
      throw new ValidationFailedException("Validation failed", errors);
    }
  }

  /** The store rejected the write. */
  record ConstraintViolated(ConstraintViolationException violation) implements WriteResult {
    public ConstraintViolated {
      Objects.requireNonNull(violation, "violation");
    }

    @Override public boolean isSuccess() { return false; }

    @Override
    public WriteResult strict() {
      throw violation;
    }

    @Override
    public DocumentId orThrow() {
      throw violation;
    }
  }
}
