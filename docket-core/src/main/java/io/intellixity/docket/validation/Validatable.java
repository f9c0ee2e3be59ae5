package io.intellixity.docket.validation;

import io.intellixity.docket.validation.expect.Expectations;

/**
 * Implemented by document types that validate themselves before writes.
 * <p>
 * The hook records failures through {@code expect} (or directly on {@link Expectations#errors()}); it
 * must not throw for invalid data.
 */
public interface Validatable {
  void validate(Expectations expect);
}
