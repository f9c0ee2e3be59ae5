package io.intellixity.docket.validation.expect;

import java.util.Collection;

/**
 * Contributes named expectations. Implementations are listed in {@code META-INF/docket.factories}
 * under this interface's name and need a public no-arg constructor.
 */
public interface ExpectationProvider {
  Collection<Expectation> expectations();
}
