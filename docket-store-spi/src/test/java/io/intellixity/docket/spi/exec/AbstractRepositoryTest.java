package io.intellixity.docket.spi.exec;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.*;
import io.intellixity.docket.observer.DocumentObserver;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.spi.Person;
import io.intellixity.docket.value.DocumentId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractRepositoryTest {
  private final List<String> journal = new ArrayList<>();

  private RecordingRepository<Person.Strict> repo(ObserverRegistry observers) {
    return new RecordingRepository<>(
        new CollectionBinding<>(Person.Strict.class, "people", Person.Strict::new), observers, journal);
  }

  private DocumentObserver<Document> tracing(String name) {
    return new DocumentObserver<>() {
      @Override public void beforeValidate(Document d) { journal.add(name + ".beforeValidate"); }
      @Override public void afterValidate(Document d) { journal.add(name + ".afterValidate"); }
      @Override public void beforeInsert(Document d) { journal.add(name + ".beforeInsert"); }
      @Override public void beforeUpdate(Document d) { journal.add(name + ".beforeUpdate"); }
      @Override public void beforeInsertOrUpdate(Document d) { journal.add(name + ".beforeSave"); }
      @Override public void afterInsert(Document d) { journal.add(name + ".afterInsert"); }
      @Override public void afterUpdate(Document d) { journal.add(name + ".afterUpdate"); }
      @Override public void afterInsertOrUpdate(Document d) { journal.add(name + ".afterSave"); }
      @Override public void beforeRemove(Document d) { journal.add(name + ".beforeRemove"); }
      @Override public void afterRemove(Document d) { journal.add(name + ".afterRemove"); }
    };
  }

  private static Person.Strict valid() {
    Person.Strict p = new Person.Strict();
    p.set("name", "Ada").set("email", "ada@example.org");
    return p;
  }

  @Test
  void insert_firesHooksInRegistrationOrderAroundStoreCall() {
    ObserverRegistry observers = ObserverRegistry.builder()
        .register(Person.Strict.class, tracing("o1"))
        .register(Person.Strict.class, tracing("o2"))
        .build();
    Person.Strict p = valid();

    WriteResult r = repo(observers).insert(p);

    assertTrue(r.isSuccess());
    assertEquals(List.of(
        "o1.beforeValidate", "o2.beforeValidate",
        "o1.afterValidate", "o2.afterValidate",
        "o1.beforeInsert", "o2.beforeInsert",
        "o1.beforeSave", "o2.beforeSave",
        "store.insert",
        "o1.afterInsert", "o2.afterInsert",
        "o1.afterSave", "o2.afterSave"), journal);
    assertTrue(p.isPersisted());
    assertEquals(r.orThrow(), p.id());
  }

  @Test
  void update_firesUpdateHooks() {
    var repo = repo(ObserverRegistry.builder().register(Person.Strict.class, tracing("o")).build());
    Person.Strict p = valid();
    repo.insert(p).orThrow();
    journal.clear();

    p.set("name", "Grace");
    assertTrue(repo.update(p).isSuccess());

    assertEquals(List.of("o.beforeValidate", "o.afterValidate", "o.beforeUpdate", "o.beforeSave",
        "store.replace", "o.afterUpdate", "o.afterSave"), journal);
    assertEquals("Grace", repo.records.get((String) p.id().value()).get("name"));
  }

  @Test
  void remove_firesRemoveHooksAndMarksRemoved() {
    var repo = repo(ObserverRegistry.builder().register(Person.Strict.class, tracing("o")).build());
    Person.Strict p = valid();
    repo.insert(p).orThrow();
    journal.clear();

    assertTrue(repo.remove(p));

    assertEquals(List.of("o.beforeRemove", "store.delete", "o.afterRemove"), journal);
    assertTrue(p.isRemoved());
  }

  @Test
  void throwingBeforeHook_abortsLaterObserversAndStoreCall() {
    DocumentObserver<Person.Strict> failing = new DocumentObserver<>() {
      @Override public void beforeInsert(Person.Strict d) { throw new IllegalStateException("nope"); }
    };
    var repo = repo(ObserverRegistry.builder()
        .register(Person.Strict.class, failing)
        .register(Person.Strict.class, tracing("o2"))
        .build());
    Person.Strict p = valid();

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> repo.insert(p));

    assertEquals("nope", e.getMessage());
    assertFalse(journal.contains("o2.beforeInsert"));
    assertFalse(journal.contains("store.insert"));
    assertTrue(p.isNew());
    assertNull(p.id());
  }

  @Test
  void throwingAfterHook_propagatesButWriteHasHappened() {
    DocumentObserver<Person.Strict> failing = new DocumentObserver<>() {
      @Override public void afterInsert(Person.Strict d) { throw new IllegalArgumentException("late"); }
    };
    var repo = repo(ObserverRegistry.builder().register(Person.Strict.class, failing).build());
    Person.Strict p = valid();

    assertThrows(IllegalArgumentException.class, () -> repo.insert(p));

    assertTrue(p.isPersisted());
    assertEquals(1, repo.records.size());
  }

  @Test
  void invalidDocument_isNotWrittenAndSkipsWriteHooks() {
    var repo = repo(ObserverRegistry.builder().register(Person.Strict.class, tracing("o")).build());
    Person.Strict p = new Person.Strict();

    WriteResult r = repo.insert(p);

    WriteResult.Invalid invalid = assertInstanceOf(WriteResult.Invalid.class, r);
    assertEquals(List.of("name can't be empty", "email can't be empty"), invalid.errors().fullMessages());
    assertEquals(List.of("o.beforeValidate", "o.afterValidate"), journal);
    assertTrue(p.isNew());
    assertSame(r, r.strict());
    ValidationFailedException e = assertThrows(ValidationFailedException.class, r::orThrow);
    assertSame(p.errors(), e.errors());
  }

  @Test
  void skipValidation_writesInvalidDocumentWithoutValidateHooks() {
    var repo = repo(ObserverRegistry.builder().register(Person.Strict.class, tracing("o")).build());
    Person.Strict p = new Person.Strict();

    assertTrue(repo.insert(p, WriteOptions.skipValidation()).isSuccess());

    assertFalse(journal.contains("o.beforeValidate"));
    assertTrue(p.isPersisted());
  }

  @Test
  void constraintViolation_isReturnedAndLeavesDocumentNew() {
    var repo = repo(ObserverRegistry.empty());
    repo.rejectNextWrite = new RuntimeException("dup");
    Person.Strict p = valid();

    WriteResult r = repo.insert(p);

    WriteResult.ConstraintViolated cv = assertInstanceOf(WriteResult.ConstraintViolated.class, r);
    assertEquals("insert", cv.violation().operation());
    assertEquals("people", cv.violation().collection());
    assertEquals("dup", cv.violation().getCause().getMessage());
    assertTrue(p.isNew());
    assertThrows(ConstraintViolationException.class, r::strict);
  }

  @Test
  void constraintViolationOnUpdate_keepsDocumentPersisted() {
    var repo = repo(ObserverRegistry.empty());
    Person.Strict p = valid();
    DocumentId id = repo.insert(p).orThrow();
    repo.rejectNextWrite = new RuntimeException("dup");

    WriteResult r = repo.update(p);

    WriteResult.ConstraintViolated cv = assertInstanceOf(WriteResult.ConstraintViolated.class, r);
    assertEquals(id, cv.violation().documentId());
    assertTrue(p.isPersisted());
  }

  @Test
  void lifecycleMisuse_raisesPreconditionViolation() {
    var repo = repo(ObserverRegistry.empty());
    Person.Strict p = valid();

    assertThrows(PreconditionViolationException.class, () -> repo.update(p));
    assertThrows(PreconditionViolationException.class, () -> repo.remove(p));
    assertThrows(PreconditionViolationException.class, () -> repo.reload(p));

    repo.insert(p).orThrow();
    assertThrows(PreconditionViolationException.class, () -> repo.insert(p));

    repo.remove(p);
    assertThrows(PreconditionViolationException.class, () -> repo.remove(p));
    assertThrows(PreconditionViolationException.class, () -> repo.update(p));
    assertThrows(PreconditionViolationException.class, () -> repo.save(p));
  }

  @Test
  void update_matchingNothing_raisesPreconditionViolation() {
    var repo = repo(ObserverRegistry.empty());
    Person.Strict p = valid();
    repo.insert(p).orThrow();
    repo.replaceMatchesNothing = true;

    assertThrows(PreconditionViolationException.class, () -> repo.update(p));
  }

  @Test
  void save_dispatchesOnState() {
    var repo = repo(ObserverRegistry.empty());
    Person.Strict p = valid();

    repo.save(p).orThrow();
    p.set("name", "Grace");
    repo.save(p).orThrow();

    assertEquals(List.of("store.insert", "store.replace"), journal);
  }

  @Test
  void find_isLazyUntilFirstNext() {
    var repo = repo(ObserverRegistry.empty());
    repo.insert(valid()).orThrow();
    journal.clear();

    try (Cursor<Person.Strict> c = repo.find(Map.of())) {
      assertEquals(0, repo.opened.get());
      Person.Strict first = c.next();
      assertNotNull(first);
      assertTrue(first.isPersisted());
      assertEquals("Ada", first.getString("name"));
      assertEquals(1, repo.opened.get());
      assertNull(c.next());
      assertTrue(c.isExhausted());
      assertNull(c.next());
      assertEquals(1, repo.opened.get());
    }
    assertEquals(List.of("store.find", "store.close"), journal);
  }

  @Test
  void findOne_andReload_readStoredState() {
    var repo = repo(ObserverRegistry.empty());
    Person.Strict p = valid();
    DocumentId id = repo.insert(p).orThrow();

    Person.Strict found = repo.findOne(id).orElseThrow();
    assertEquals(id, found.id());
    assertNotSame(p, found);

    p.set("name", "local edit");
    assertTrue(repo.reload(p));
    assertEquals("Ada", p.getString("name"));

    repo.records.clear();
    assertFalse(repo.reload(p));
    assertEquals("Ada", p.getString("name"));
    assertTrue(repo.findOne(id).isEmpty());
  }

  @Test
  void nullFilter_isTreatedAsEmpty() {
    var repo = repo(ObserverRegistry.empty());
    repo.insert(valid()).orThrow();

    assertEquals(1, repo.count(null));
    assertTrue(repo.findOne((Map<String, Object>) null).isPresent());
    assertFalse(repo.isEmpty());
  }
}
