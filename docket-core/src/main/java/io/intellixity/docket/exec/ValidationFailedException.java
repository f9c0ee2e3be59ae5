package io.intellixity.docket.exec;

import io.intellixity.docket.validation.ErrorCollector;

/** Raised only when a caller escalates an invalid {@link WriteResult} with {@link WriteResult#orThrow()}. */
public class ValidationFailedException extends RuntimeException {
  private final transient ErrorCollector errors;

  public ValidationFailedException(String message, ErrorCollector errors) {
    super(message + ": " + errors);
    this.errors = errors;
  }

  public ErrorCollector errors() {
    return errors;
  }
}
