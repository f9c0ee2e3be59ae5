package io.intellixity.docket.examples.service;

import io.intellixity.docket.examples.domain.User;
import io.intellixity.docket.examples.observer.UserAuditObserver;
import io.intellixity.docket.exec.FindOptions;
import io.intellixity.docket.exec.WriteResult;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.spi.memory.InMemoryStore;
import io.intellixity.docket.value.DocumentId;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class UserServiceTest {
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private final InMemoryStore store = new InMemoryStore(ObserverRegistry.builder()
      .register(User.class, new UserAuditObserver(Clock.fixed(NOW, ZoneOffset.UTC)))
      .build()).ensureUniqueIndex("users", "email");
  private final UserService service = new UserService(store.create(User.class, User::new));

  @Test
  void create_stampsAuditFieldsAndPersists() {
    UserService.Saved saved = service.create(Map.of("name", "Ada", "email", "ada@example.org"));

    assertTrue(saved.result().isSuccess());
    User u = saved.user();
    assertTrue(u.isPersisted());
    assertEquals(NOW, u.raw("createdAt"));
    assertEquals(NOW, u.raw("updatedAt"));

    User stored = service.get(u.id().toString()).orElseThrow();
    assertEquals("Ada", stored.name());
    assertEquals(NOW, stored.raw("createdAt"));
  }

  @Test
  void create_withMissingFields_reportsFullMessagesInOrder() {
    UserService.Saved saved = service.create(Map.of("age", "old"));

    WriteResult.Invalid invalid = assertInstanceOf(WriteResult.Invalid.class, saved.result());
    assertEquals(List.of("name can't be empty", "email can't be empty", "age must be a number"),
        invalid.errors().fullMessages());
    assertEquals(0, service.count(Map.of()));
  }

  @Test
  void create_withMalformedEmail_isInvalid() {
    UserService.Saved saved = service.create(Map.of("name", "Ada", "email", "not-an-email"));

    assertEquals(List.of("is not an email address"), saved.user().errors().on("email"));
  }

  @Test
  void create_withTakenEmail_isConstraintViolation() {
    service.create(Map.of("name", "Ada", "email", "ada@example.org")).result().orThrow();

    UserService.Saved second = service.create(Map.of("name", "Imposter", "email", "ada@example.org"));

    assertInstanceOf(WriteResult.ConstraintViolated.class, second.result());
    assertTrue(second.user().isNew());
  }

  @Test
  void update_appliesChangesAndUnsetsNulls() {
    User u = service.create(Map.of("name", "Ada", "email", "ada@example.org", "nick", "countess")).user();
    Map<String, Object> changes = new HashMap<>();
    changes.put("name", "Ada Lovelace");
    changes.put("nick", null);

    UserService.Saved saved = service.update(u.id().toString(), changes).orElseThrow();

    assertTrue(saved.result().isSuccess());
    User stored = service.get(u.id().toString()).orElseThrow();
    assertEquals("Ada Lovelace", stored.name());
    assertFalse(stored.has("nick"));
  }

  @Test
  void identityInRequestBody_isRejectedAndNothingIsWritten() {
    assertThrows(IllegalArgumentException.class,
        () -> service.create(Map.of("_id", "custom-1", "name", "Ada", "email", "ada@example.org")));
    assertEquals(0, service.count(null));

    User u = service.create(Map.of("name", "Ada", "email", "ada@example.org")).user();
    assertThrows(IllegalArgumentException.class, () -> service.update(u.id().toString(), Map.of("_id", "custom-2")));
    User stored = service.get(u.id().toString()).orElseThrow();
    assertEquals(u.id(), stored.id());
    assertFalse(stored.fields().containsKey("_id"));
  }

  @Test
  void update_ofUnknownUser_isEmpty() {
    assertTrue(service.update("missing", Map.of("name", "x")).isEmpty());
  }

  @Test
  void delete_removesOnce() {
    User u = service.create(Map.of("name", "Ada", "email", "ada@example.org")).user();

    assertTrue(service.delete(u.id().toString()));
    assertFalse(service.delete(u.id().toString()));
    assertTrue(service.get(u.id().toString()).isEmpty());
  }

  @Test
  void search_sortsAndLimits() {
    service.create(Map.of("name", "Cy", "email", "c@example.org", "team", "a")).result().orThrow();
    service.create(Map.of("name", "Ada", "email", "a@example.org", "team", "a")).result().orThrow();
    service.create(Map.of("name", "Bob", "email", "b@example.org", "team", "b")).result().orThrow();

    List<User> team = service.search(Map.of("team", "a"), FindOptions.none().sortBy("name", 1));

    assertEquals(List.of("Ada", "Cy"), team.stream().map(User::name).toList());
    assertEquals(1, service.search(null, FindOptions.none().limit(1)).size());
    assertEquals(3, service.count(null));
  }

  @Test
  void parseId_recognizesObjectIds() {
    ObjectId oid = new ObjectId();
    assertEquals(DocumentId.of(oid), UserService.parseId(oid.toHexString()));
    assertEquals(DocumentId.of("k-1"), UserService.parseId("k-1"));
    assertThrows(IllegalArgumentException.class, () -> UserService.parseId(" "));
  }
}
