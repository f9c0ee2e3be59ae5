package io.intellixity.docket.document;

import io.intellixity.docket.exec.PreconditionViolationException;
import io.intellixity.docket.validation.ErrorCollector;
import io.intellixity.docket.validation.Validatable;
import io.intellixity.docket.validation.expect.ExpectationRegistry;
import io.intellixity.docket.validation.expect.Expectations;
import io.intellixity.docket.value.DocValue;
import io.intellixity.docket.value.DocValues;
import io.intellixity.docket.value.DocumentId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory representation of one stored record.
 * <p>
 * Fields form an ordered, nested key/value tree addressed by dotted paths ({@code "address.city"}).
 * Reading an unset path yields {@link DocValue#NULL}; it never fails.
 * <p>
 * Lifecycle: {@code NEW -> PERSISTED -> REMOVED}. The identity is assigned exactly once, on the
 * transition out of {@code NEW}, and never changes afterwards. Transitions are driven by repositories.
 * <p>
 * Subclasses bind a type to a repository and may implement {@link Validatable}.
 */
public class Document {
  /** Name under which stores keep the identity; never a field of the document. */
  public static final String ID_FIELD = "_id";

  private final LinkedHashMap<String, DocValue> fields = new LinkedHashMap<>();
  private DocumentId id;
  private DocumentState state = DocumentState.NEW;
  private ErrorCollector errors = new ErrorCollector();

  public Document() {}

  public Document(Map<String, ?> initial) {
    if (initial != null) initial.forEach(this::set);
  }

  public final DocumentId id() { return id; }
  public final DocumentState state() { return state; }
  public final boolean isNew() { return state == DocumentState.NEW; }
  public final boolean isPersisted() { return state == DocumentState.PERSISTED; }
  public final boolean isRemoved() { return state == DocumentState.REMOVED; }

  /** Errors recorded by the most recent validation pass. */
  public final ErrorCollector errors() { return errors; }

  /** Top-level fields, read-only. */
  public final Map<String, DocValue> fields() {
    return Collections.unmodifiableMap(fields);
  }

  public final DocValue get(String path) {
    String[] parts = split(path);
    DocValue cur = fields.get(parts[0]);
    for (int i = 1; i < parts.length && cur != null; i++) {
      if (!(cur instanceof DocValue.Tree t)) return DocValue.NULL;
      cur = t.entries().get(parts[i]);
    }
    return cur == null ? DocValue.NULL : cur;
  }

  /** Plain Java view of {@link #get(String)}. */
  public final Object raw(String path) {
    return get(path).toJava();
  }

  public final String getString(String path) {
    return DocValues.textOrNull(get(path));
  }

  public final boolean has(String path) {
    String[] parts = split(path);
    if (parts.length == 1) return fields.containsKey(parts[0]);
    DocValue cur = fields.get(parts[0]);
    for (int i = 1; i < parts.length - 1; i++) {
      if (!(cur instanceof DocValue.Tree t)) return false;
      cur = t.entries().get(parts[i]);
    }
    return (cur instanceof DocValue.Tree t) && t.entries().containsKey(parts[parts.length - 1]);
  }

  /**
   * Sets a field, creating intermediate trees for dotted paths. An intermediate value that is not a tree
   * is replaced by one. The identity is not a field: setting {@value #ID_FIELD} is rejected.
   */
  public Document set(String path, Object value) {
    String[] parts = fieldPath(path);
    DocValue v = DocValues.of(value);
    if (parts.length == 1) {
      fields.put(parts[0], v);
      return this;
    }
    DocValue.Tree root = asTree(fields.get(parts[0]));
    fields.put(parts[0], setIn(root, parts, 1, v));
    return this;
  }

  public Document unset(String path) {
    String[] parts = fieldPath(path);
    if (parts.length == 1) {
      fields.remove(parts[0]);
      return this;
    }
    DocValue top = fields.get(parts[0]);
    if (top instanceof DocValue.Tree t) fields.put(parts[0], unsetIn(t, parts, 1));
    return this;
  }

  /** Runs validation with the default expectation registry. */
  public final boolean isValid() {
    return isValid(ExpectationRegistry.defaults());
  }

  /**
   * Runs a validation pass: a fresh {@link ErrorCollector} replaces the previous one, the
   * {@link Validatable#validate(Expectations)} hook runs if this type declares one, and the result is
   * whether the collector stayed empty.
   */
  public final boolean isValid(ExpectationRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    ErrorCollector fresh = new ErrorCollector();
    this.errors = fresh;
    if (this instanceof Validatable v) v.validate(new Expectations(fresh, registry));
    return fresh.isEmpty();
  }

  // --- lifecycle transitions ---
  // For store bindings only (repositories and codecs). Application code that calls these moves a document
  // between states without touching the store.

  /** {@code NEW -> PERSISTED} after a successful insert. For store bindings only. */
  public final void markInserted(DocumentId assigned) {
    Objects.requireNonNull(assigned, "assigned");
    if (state != DocumentState.NEW) {
      throw new PreconditionViolationException("Cannot insert " + describe() + ": document is not new");
    }
    this.id = assigned;
    this.state = DocumentState.PERSISTED;
  }

  /** {@code PERSISTED -> REMOVED} after a remove. For store bindings only. */
  public final void markRemoved() {
    if (state != DocumentState.PERSISTED) {
      throw new PreconditionViolationException("Cannot remove " + describe() + ": document is not persisted");
    }
    this.state = DocumentState.REMOVED;
  }

  /**
   * Hydrates a fresh instance from a stored record: {@code NEW -> PERSISTED}. For store bindings only;
   * {@code storedFields} must not contain {@value #ID_FIELD}.
   */
  public final void load(DocumentId storedId, Map<String, DocValue> storedFields) {
    Objects.requireNonNull(storedId, "storedId");
    if (state != DocumentState.NEW || id != null) {
      throw new PreconditionViolationException("Cannot load stored record into " + describe());
    }
    rejectIdField(storedFields);
    this.id = storedId;
    this.state = DocumentState.PERSISTED;
    replaceFields(storedFields);
  }

  /** Replaces all fields with a stored copy (reload); identity and state are untouched. */
  public final void replaceFields(Map<String, DocValue> storedFields) {
    rejectIdField(storedFields);
    fields.clear();
    if (storedFields != null) {
      storedFields.forEach((k, v) -> fields.put(k, v == null ? DocValue.NULL : v));
    }
  }

  /** Short description for diagnostics: type, identity and state. */
  public final String describe() {
    return getClass().getSimpleName() + "[id=" + id + ", state=" + state + "]";
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", state=" + state + ", fields=" + fields + "}";
  }

  private static String[] split(String path) {
    if (path == null || path.isBlank()) throw new IllegalArgumentException("path is required");
    String[] parts = path.split("\\.", -1);
    for (String part : parts) {
      if (part.isEmpty()) throw new IllegalArgumentException("Empty segment in path: '" + path + "'");
    }
    return parts;
  }

  private static String[] fieldPath(String path) {
    String[] parts = split(path);
    if (ID_FIELD.equals(parts[0])) {
      throw new IllegalArgumentException(ID_FIELD + " is the document identity, not a field");
    }
    return parts;
  }

  private static void rejectIdField(Map<String, DocValue> storedFields) {
    if (storedFields != null && storedFields.containsKey(ID_FIELD)) {
      throw new IllegalArgumentException("Stored fields must not contain " + ID_FIELD);
    }
  }

  private static DocValue.Tree asTree(DocValue v) {
    return (v instanceof DocValue.Tree t) ? t : DocValue.Tree.empty();
  }

  private static DocValue.Tree setIn(DocValue.Tree node, String[] parts, int i, DocValue v) {
    if (i == parts.length - 1) return node.with(parts[i], v);
    DocValue.Tree child = asTree(node.entries().get(parts[i]));
    return node.with(parts[i], setIn(child, parts, i + 1, v));
  }

  private static DocValue.Tree unsetIn(DocValue.Tree node, String[] parts, int i) {
    if (i == parts.length - 1) return node.without(parts[i]);
    DocValue child = node.entries().get(parts[i]);
    if (!(child instanceof DocValue.Tree t)) return node;
    return node.with(parts[i], unsetIn(t, parts, i + 1));
  }
}
