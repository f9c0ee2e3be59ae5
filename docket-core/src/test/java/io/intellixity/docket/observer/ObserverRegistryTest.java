package io.intellixity.docket.observer;

import io.intellixity.docket.document.Document;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ObserverRegistryTest {

  static final class Account extends Document {}

  static final class Invoice extends Document {}

  static final class Recording implements DocumentObserver<Document> {
    private final String name;
    private final List<String> calls;

    Recording(String name, List<String> calls) {
      this.name = name;
      this.calls = calls;
    }

    @Override public void beforeInsert(Document doc) { calls.add(name + ".beforeInsert"); }
    @Override public void afterInsert(Document doc) { calls.add(name + ".afterInsert"); }
  }

  @Test
  void observersFor_keepsRegistrationOrder() {
    List<String> calls = new ArrayList<>();
    Recording o1 = new Recording("o1", calls);
    Recording o2 = new Recording("o2", calls);
    ObserverRegistry reg = ObserverRegistry.builder()
        .register(Account.class, o1)
        .register(Account.class, o2)
        .build();

    assertEquals(List.of(o1, o2), reg.observersFor(Account.class));
  }

  @Test
  void lookupIsByExactClass() {
    ObserverRegistry reg = ObserverRegistry.builder()
        .register(Account.class, new DocumentObserver<Account>() {})
        .build();

    assertEquals(1, reg.observersFor(Account.class).size());
    assertTrue(reg.observersFor(Invoice.class).isEmpty());
    assertTrue(reg.observersFor(Document.class).isEmpty());
    assertEquals(Set.of(Account.class), reg.observedTypes());
  }

  @Test
  void builtRegistry_isUnaffectedByLaterRegistration() {
    ObserverRegistry.Builder b = ObserverRegistry.builder().register(Account.class, new DocumentObserver<Account>() {});
    ObserverRegistry reg = b.build();
    b.register(Account.class, new DocumentObserver<Account>() {});

    assertEquals(1, reg.observersFor(Account.class).size());
    assertThrows(UnsupportedOperationException.class, () -> reg.observersFor(Account.class).clear());
  }

  @Test
  void dispatcher_firesEachObserverInOrder() {
    List<String> calls = new ArrayList<>();
    ObserverRegistry reg = ObserverRegistry.builder()
        .register(Account.class, new Recording("o1", calls))
        .register(Account.class, new Recording("o2", calls))
        .build();
    ObserverDispatcher<Account> d = new ObserverDispatcher<>(Account.class, reg);

    d.fire(HookPoint.BEFORE_INSERT, new Account());
    d.fire(HookPoint.AFTER_INSERT, new Account());
    d.fire(HookPoint.BEFORE_REMOVE, new Account());

    assertEquals(List.of("o1.beforeInsert", "o2.beforeInsert", "o1.afterInsert", "o2.afterInsert"), calls);
  }

  @Test
  void dispatcher_stopsAtFirstFailingObserver() {
    List<String> calls = new ArrayList<>();
    ObserverRegistry reg = ObserverRegistry.builder()
        .register(Account.class, new DocumentObserver<Account>() {
          @Override public void beforeUpdate(Account doc) { throw new IllegalStateException("veto"); }
        })
        .register(Account.class, new DocumentObserver<Account>() {
          @Override public void beforeUpdate(Account doc) { calls.add("second"); }
        })
        .build();
    ObserverDispatcher<Account> d = new ObserverDispatcher<>(Account.class, reg);

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> d.fire(HookPoint.BEFORE_UPDATE, new Account()));
    assertEquals("veto", ex.getMessage());
    assertTrue(calls.isEmpty());
  }
}
