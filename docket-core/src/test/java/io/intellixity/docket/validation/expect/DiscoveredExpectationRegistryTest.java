package io.intellixity.docket.validation.expect;

import io.intellixity.docket.value.DocValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredExpectationRegistryTest {

  @Test
  void builtinsAlwaysRegistered() {
    DiscoveredExpectationRegistry reg = new DiscoveredExpectationRegistry(List.of());
    assertEquals(List.of("present", "true", "numeric", "match", "length"), List.copyOf(reg.names()));
  }

  @Test
  void factoriesResource_contributesProviders() {
    DiscoveredExpectationRegistry reg = new DiscoveredExpectationRegistry();
    assertTrue(reg.contains("email"));
    assertTrue(reg.contains("present"));
  }

  @Test
  void duplicateName_failsConstruction() {
    ExpectationProvider dup = () -> List.of(new Expectation() {
      @Override public String name() { return "present"; }
      @Override public boolean toBe(DocValue value, ExpectOptions options) { return true; }
    });

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> new DiscoveredExpectationRegistry(List.of(dup)));
    assertTrue(ex.getMessage().contains("Duplicate expectation 'present'"));
  }
}
