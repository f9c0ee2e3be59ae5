package io.intellixity.docket.exec;

/**
 * A persistence operation was called on a document whose lifecycle state does not allow it
 * (insert of a persisted document, update without identity, remove of a removed document).
 * Always a programming error; never reported through a {@link WriteResult}.
 */
public class PreconditionViolationException extends IllegalStateException {
  public PreconditionViolationException(String message) {
    super(message);
  }
}
