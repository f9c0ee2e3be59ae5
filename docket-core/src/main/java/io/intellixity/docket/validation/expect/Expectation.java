package io.intellixity.docket.validation.expect;

import io.intellixity.docket.value.DocValue;

/**
 * A named check evaluated against one value.
 * <p>
 * {@link #toBe} decides the positive form, {@link #notToBe} the negated one. Null handling for
 * {@code allowNull} is applied by {@link Expectations} before either is called.
 */
public interface Expectation {
  String name();

  boolean toBe(DocValue value, ExpectOptions options);

  default boolean notToBe(DocValue value, ExpectOptions options) {
    return !toBe(value, options);
  }
}
