package io.intellixity.docket.examples.web;

import io.intellixity.docket.examples.domain.User;
import io.intellixity.docket.examples.service.UserService;
import io.intellixity.docket.exec.FindOptions;
import io.intellixity.docket.exec.WriteResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users")
public final class UserController {
  private final UserService users;

  public UserController(UserService users) {
    this.users = users;
  }

  public record SearchRequest(Map<String, Object> filter, Map<String, Integer> sort, Integer skip, Integer limit) {
    FindOptions options() {
      return new FindOptions(sort, skip, limit);
    }
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> create(@RequestBody Map<String, Object> fields) {
    return respond(users.create(fields), HttpStatus.CREATED);
  }

  @GetMapping("/{id}")
  public ResponseEntity<User> get(@PathVariable("id") String id) {
    return users.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> update(@PathVariable("id") String id, @RequestBody Map<String, Object> changes) {
    return users.update(id, changes)
        .<ResponseEntity<?>>map(s -> respond(s, HttpStatus.OK))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    return users.delete(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
  public List<User> search(@RequestBody SearchRequest req) {
    return users.search(req.filter(), req.options());
  }

  @PostMapping("/count")
  public long count(@RequestBody(required = false) Map<String, Object> filter) {
    return users.count(filter);
  }

  private static ResponseEntity<?> respond(UserService.Saved saved, HttpStatus onSuccess) {
    WriteResult r = saved.result();
    if (r instanceof WriteResult.Invalid invalid) {
      return ResponseEntity.unprocessableEntity().body(Map.of("errors", invalid.errors().fullMessages()));
    }
    if (r instanceof WriteResult.ConstraintViolated cv) {
      return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", cv.violation().getMessage()));
    }
    return ResponseEntity.status(onSuccess).body(saved.user());
  }
}
