package io.intellixity.docket.validation.expect;

import io.intellixity.docket.value.DocValue;
import io.intellixity.docket.value.DocValues;

import java.util.Collection;
import java.util.List;

/** Registered through src/test/resources/META-INF/docket.factories. */
public final class EmailExpectationProvider implements ExpectationProvider {
  @Override
  public Collection<Expectation> expectations() {
    return List.of(new Expectation() {
      @Override public String name() { return "email"; }

      @Override
      public boolean toBe(DocValue value, ExpectOptions options) {
        String s = DocValues.textOrNull(value);
        return s != null && s.indexOf('@') > 0 && s.indexOf('@') < s.length() - 1;
      }
    });
  }
}
