package io.intellixity.docket.exec;

/**
 * Per-call write options.
 *
 * @param validate run the document's validation before writing
 */
public record WriteOptions(boolean validate) {
  private static final WriteOptions DEFAULTS = new WriteOptions(true);
  private static final WriteOptions UNCHECKED = new WriteOptions(false);

  public static WriteOptions defaults() { return DEFAULTS; }

  /** Writes without validating; observers for validation hooks are not called either. */
  public static WriteOptions skipValidation() { return UNCHECKED; }
}
