package io.intellixity.docket.validation.expect;

/** Resolves expectations by name. */
public interface ExpectationRegistry {
  /** @throws IllegalArgumentException if no expectation has this name */
  Expectation get(String name);

  boolean contains(String name);

  /** Built-ins plus everything discovered on the context class path, resolved once. */
  static ExpectationRegistry defaults() {
    return DefaultsHolder.INSTANCE;
  }

  final class DefaultsHolder {
    private static final ExpectationRegistry INSTANCE = new DiscoveredExpectationRegistry();

    private DefaultsHolder() {}
  }
}
