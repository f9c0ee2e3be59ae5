package io.intellixity.docket.examples.service;

import io.intellixity.docket.examples.domain.User;
import io.intellixity.docket.exec.Cursor;
import io.intellixity.docket.exec.FindOptions;
import io.intellixity.docket.exec.Repository;
import io.intellixity.docket.exec.WriteResult;
import io.intellixity.docket.value.DocumentId;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
public final class UserService {
  private final Repository<User> users;

  public UserService(Repository<User> users) {
    this.users = Objects.requireNonNull(users, "users");
  }

  /** A write outcome together with the document it was attempted on. */
  public record Saved(User user, WriteResult result) {}

  public Saved create(Map<String, Object> fields) {
    User u = new User();
    if (fields != null) fields.forEach(u::set);
    return new Saved(u, users.insert(u));
  }

  public Optional<User> get(String id) {
    return users.findOne(parseId(id));
  }

  /** Applies the given fields on top of the stored user; a null value unsets the field. */
  public Optional<Saved> update(String id, Map<String, Object> changes) {
    Optional<User> found = get(id);
    if (found.isEmpty()) return Optional.empty();
    User u = found.get();
    if (changes != null) {
      changes.forEach((k, v) -> {
        if (v == null) u.unset(k);
        else u.set(k, v);
      });
    }
    return Optional.of(new Saved(u, users.update(u)));
  }

  public boolean delete(String id) {
    Optional<User> found = get(id);
    return found.isPresent() && users.remove(found.get());
  }

  public List<User> search(Map<String, Object> filter, FindOptions options) {
    try (Cursor<User> c = users.find(filter, options)) {
      return c.toList();
    }
  }

  public long count(Map<String, Object> filter) {
    return users.count(filter);
  }

  /** Hex strings that look like ObjectIds are treated as such; anything else is kept as a string id. */
  static DocumentId parseId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
    return ObjectId.isValid(id) ? DocumentId.of(new ObjectId(id)) : DocumentId.of(id);
  }
}
