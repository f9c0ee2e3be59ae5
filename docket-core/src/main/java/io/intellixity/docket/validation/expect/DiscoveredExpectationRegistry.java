package io.intellixity.docket.validation.expect;

import io.intellixity.docket.util.DocketFactoriesLoader;

import java.util.*;

/**
 * Expectation registry built from {@link BuiltinExpectations} and discovered
 * {@link ExpectationProvider}s (META-INF/docket.factories).
 * <p>
 * Names are unique: a provider contributing a name that is already registered fails construction.
 */
public final class DiscoveredExpectationRegistry implements ExpectationRegistry {
  private final Map<String, Expectation> byName;

  public DiscoveredExpectationRegistry() {
    this(DocketFactoriesLoader.load(ExpectationProvider.class));
  }

  public DiscoveredExpectationRegistry(List<ExpectationProvider> providers) {
    Map<String, Expectation> m = new LinkedHashMap<>();
    register(m, new BuiltinExpectations());
    for (ExpectationProvider p : providers) {
      if (p == null || p instanceof BuiltinExpectations) continue;
      register(m, p);
    }
    this.byName = Collections.unmodifiableMap(m);
  }

  private static void register(Map<String, Expectation> m, ExpectationProvider p) {
    Collection<Expectation> es = p.expectations();
    if (es == null) return;
    for (Expectation e : es) {
      String name = Objects.requireNonNull(e.name(), "expectation name");
      Expectation prev = m.putIfAbsent(name, e);
      if (prev != null) {
        throw new IllegalStateException("Duplicate expectation '" + name + "' from " + p.getClass().getName()
            + " (already provided by " + prev.getClass().getName() + ")");
      }
    }
  }

  @Override
  public Expectation get(String name) {
    Expectation e = byName.get(name);
    if (e == null) throw new IllegalArgumentException("Unknown expectation: " + name + " (known: " + byName.keySet() + ")");
    return e;
  }

  @Override
  public boolean contains(String name) {
    return byName.containsKey(name);
  }

  public Set<String> names() {
    return byName.keySet();
  }
}
