package io.intellixity.docket.validation.expect;

import io.intellixity.docket.value.DocValue;
import io.intellixity.docket.value.DocValues;

import java.util.Collection;
import java.util.List;

/** The built-in checks: {@code present}, {@code true}, {@code numeric}, {@code match}, {@code length}. */
public final class BuiltinExpectations implements ExpectationProvider {
  public static final String PRESENT = "present";
  public static final String TRUE = "true";
  public static final String NUMERIC = "numeric";
  public static final String MATCH = "match";
  public static final String LENGTH = "length";

  @Override
  public Collection<Expectation> expectations() {
    return List.of(new Present(), new ExactlyTrue(), new Numeric(), new Match(), new Length());
  }

  static final class Present implements Expectation {
    @Override public String name() { return PRESENT; }

    @Override
    public boolean toBe(DocValue value, ExpectOptions options) {
      return !DocValues.isBlank(value);
    }
  }

  /** Positive form: exactly {@code true}. Negated form: exactly {@code false}. */
  static final class ExactlyTrue implements Expectation {
    @Override public String name() { return TRUE; }

    @Override
    public boolean toBe(DocValue value, ExpectOptions options) {
      return value instanceof DocValue.Bool b && b.value();
    }

    @Override
    public boolean notToBe(DocValue value, ExpectOptions options) {
      return value instanceof DocValue.Bool b && !b.value();
    }
  }

  static final class Numeric implements Expectation {
    @Override public String name() { return NUMERIC; }

    @Override
    public boolean toBe(DocValue value, ExpectOptions options) {
      return DocValues.isNumeric(value);
    }
  }

  static final class Match implements Expectation {
    @Override public String name() { return MATCH; }

    @Override
    public boolean toBe(DocValue value, ExpectOptions options) {
      if (options.with() == null) throw new IllegalArgumentException("match expectation requires a pattern");
      String s = DocValues.textOrNull(value);
      return s != null && options.with().matcher(s).find();
    }
  }

  static final class Length implements Expectation {
    @Override public String name() { return LENGTH; }

    @Override
    public boolean toBe(DocValue value, ExpectOptions options) {
      if (options.minimum() == null && options.maximum() == null) {
        throw new IllegalArgumentException("length expectation requires minimum, maximum or range");
      }
      int len = DocValues.length(value);
      if (options.minimum() != null && len < options.minimum()) return false;
      return options.maximum() == null || len <= options.maximum();
    }
  }
}
