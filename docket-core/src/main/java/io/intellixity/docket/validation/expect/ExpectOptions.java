package io.intellixity.docket.validation.expect;

import java.util.regex.Pattern;

/**
 * Options for a single expectation call.
 *
 * @param allowNull null values pass regardless of polarity
 * @param with      pattern for {@code match}
 * @param minimum   inclusive lower length bound for {@code length}
 * @param maximum   inclusive upper length bound for {@code length}
 */
public record ExpectOptions(boolean allowNull, Pattern with, Integer minimum, Integer maximum) {
  private static final ExpectOptions NONE = new ExpectOptions(false, null, null, null);

  public static ExpectOptions none() { return NONE; }

  public static ExpectOptions allowingNull() { return NONE.allowNull(true); }

  public static ExpectOptions with(String regex) { return with(Pattern.compile(regex)); }

  public static ExpectOptions with(Pattern pattern) { return NONE.withPattern(pattern); }

  public static ExpectOptions minimum(int min) { return new ExpectOptions(false, null, min, null); }

  public static ExpectOptions maximum(int max) { return new ExpectOptions(false, null, null, max); }

  /** Inclusive {@code min..max}. */
  public static ExpectOptions range(int min, int max) {
    if (min > max) throw new IllegalArgumentException("range min > max: " + min + ".." + max);
    return new ExpectOptions(false, null, min, max);
  }

  public ExpectOptions allowNull(boolean allow) {
    return new ExpectOptions(allow, with, minimum, maximum);
  }

  public ExpectOptions withPattern(Pattern pattern) {
    return new ExpectOptions(allowNull, pattern, minimum, maximum);
  }
}
