package io.intellixity.docket.validation.expect;

import io.intellixity.docket.validation.ErrorCollector;
import io.intellixity.docket.value.DocValue;
import io.intellixity.docket.value.DocValues;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Declarative checks that append failures to an {@link ErrorCollector}.
 * <p>
 * Each call is atomic and appends at most one entry, tied to {@code field} with {@code message}.
 * Calls never short-circuit each other: every failing check of a pass is recorded, in call order.
 * Values may be {@link DocValue}s or plain Java values.
 */
public final class Expectations {
  private final ErrorCollector errors;
  private final ExpectationRegistry registry;

  public Expectations(ErrorCollector errors, ExpectationRegistry registry) {
    this.errors = Objects.requireNonNull(errors, "errors");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Collector of the current pass, for hooks that record errors directly. */
  public ErrorCollector errors() {
    return errors;
  }

  /** Fails when the value is null, the empty string or an empty container. */
  public Expectations expectPresent(Object value, String field, String message) {
    return expect(BuiltinExpectations.PRESENT, value, ExpectOptions.none(), field, message);
  }

  /** Fails when the value is present. */
  public Expectations notExpectPresent(Object value, String field, String message) {
    return notExpect(BuiltinExpectations.PRESENT, value, ExpectOptions.none(), field, message);
  }

  /** Fails unless the value is exactly {@code true}. */
  public Expectations expectTrue(Object value, String field, String message) {
    return expect(BuiltinExpectations.TRUE, value, ExpectOptions.none(), field, message);
  }

  /** Fails unless the value is exactly {@code false}. */
  public Expectations expectFalse(Object value, String field, String message) {
    return notExpect(BuiltinExpectations.TRUE, value, ExpectOptions.none(), field, message);
  }

  public Expectations expectNumeric(Object value, String field, String message) {
    return expectNumeric(value, field, message, ExpectOptions.none());
  }

  /** Fails unless the value is a number or text parseable as one. */
  public Expectations expectNumeric(Object value, String field, String message, ExpectOptions options) {
    return expect(BuiltinExpectations.NUMERIC, value, options, field, message);
  }

  public Expectations notExpectNumeric(Object value, String field, String message, ExpectOptions options) {
    return notExpect(BuiltinExpectations.NUMERIC, value, options, field, message);
  }

  public Expectations expectMatch(Object value, Pattern pattern, String field, String message) {
    return expectMatch(value, field, message, ExpectOptions.with(pattern));
  }

  /** Fails unless the value's text contains a match for {@code options.with()}. */
  public Expectations expectMatch(Object value, String field, String message, ExpectOptions options) {
    return expect(BuiltinExpectations.MATCH, value, options, field, message);
  }

  public Expectations notExpectMatch(Object value, Pattern pattern, String field, String message) {
    return notExpectMatch(value, field, message, ExpectOptions.with(pattern));
  }

  public Expectations notExpectMatch(Object value, String field, String message, ExpectOptions options) {
    return notExpect(BuiltinExpectations.MATCH, value, options, field, message);
  }

  /** Fails when the value's length lies outside {@code bounds} (minimum, maximum or range). */
  public Expectations expectLength(Object value, ExpectOptions bounds, String field, String message) {
    return expect(BuiltinExpectations.LENGTH, value, bounds, field, message);
  }

  /** Runs any registered expectation in its positive form. */
  public Expectations expect(String name, Object value, ExpectOptions options, String field, String message) {
    return check(name, value, options, field, message, true);
  }

  /** Runs any registered expectation in its negated form. */
  public Expectations notExpect(String name, Object value, ExpectOptions options, String field, String message) {
    return check(name, value, options, field, message, false);
  }

  private Expectations check(String name, Object value, ExpectOptions options, String field, String message,
                             boolean positive) {
    Objects.requireNonNull(message, "message");
    Expectation e = registry.get(name);
    ExpectOptions opts = (options == null) ? ExpectOptions.none() : options;
    DocValue v = DocValues.of(value);
    if (opts.allowNull() && v.isNull()) return this;
    boolean passed = positive ? e.toBe(v, opts) : e.notToBe(v, opts);
    if (!passed) errors.add(field, message);
    return this;
  }
}
