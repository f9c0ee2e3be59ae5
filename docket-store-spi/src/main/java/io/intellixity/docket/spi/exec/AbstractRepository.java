package io.intellixity.docket.spi.exec;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.*;
import io.intellixity.docket.observer.HookPoint;
import io.intellixity.docket.observer.ObserverDispatcher;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.spi.mapping.DocumentCodec;
import io.intellixity.docket.validation.expect.ExpectationRegistry;
import io.intellixity.docket.value.DocumentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Template-method orchestrator for persistence operations on one document type.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>lifecycle preconditions and state transitions of the {@link Document}</li>
 *   <li>validation (unless skipped) with validate hooks around it</li>
 *   <li>observer dispatch before and after each write</li>
 *   <li>encoding/decoding through {@link DocumentCodec}</li>
 * </ul>
 * The raw store operations are delegated to backend hooks. Hooks report store-enforced constraint
 * failures by throwing {@link ConstraintViolationException}; anything else they throw propagates.
 */
public abstract class AbstractRepository<T extends Document> implements Repository<T> {
  private static final Logger log = LoggerFactory.getLogger(AbstractRepository.class);

  private final CollectionBinding<T> binding;
  private final ObserverDispatcher<T> observers;
  private final ExpectationRegistry expectations;
  private final DocumentCodec codec;

  protected AbstractRepository(CollectionBinding<T> binding,
                               ObserverRegistry observers,
                               ExpectationRegistry expectations,
                               DocumentCodec codec) {
    this.binding = Objects.requireNonNull(binding, "binding");
    this.observers = new ObserverDispatcher<>(binding.type(), Objects.requireNonNull(observers, "observers"));
    this.expectations = Objects.requireNonNull(expectations, "expectations");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public final CollectionBinding<T> binding() { return binding; }

  protected final String collection() { return binding.collection(); }

  // --- Writes ---

  @Override
  public final WriteResult insert(T doc, WriteOptions options) {
    Objects.requireNonNull(doc, "doc");
    WriteOptions opts = (options == null) ? WriteOptions.defaults() : options;
    if (!doc.isNew()) {
      throw new PreconditionViolationException("insert requires a new document, got " + doc.describe());
    }
    long start = System.nanoTime();
    if (opts.validate() && !runValidation(doc)) {
      logWrite("insert", null, "invalid", start);
      return new WriteResult.Invalid(doc.errors());
    }

    observers.fire(HookPoint.BEFORE_INSERT, doc);
    observers.fire(HookPoint.BEFORE_INSERT_OR_UPDATE, doc);

    DocumentId id;
    try {
      id = executeInsert(codec.encode(doc));
    } catch (ConstraintViolationException e) {
      logWrite("insert", null, "constraint_violation", start);
      return new WriteResult.ConstraintViolated(e);
    }
    if (id == null) throw new IllegalStateException("Store reported no identity for insert into '" + collection() + "'");
    doc.markInserted(id);
    logWrite("insert", id, "ok", start);

    observers.fire(HookPoint.AFTER_INSERT, doc);
    observers.fire(HookPoint.AFTER_INSERT_OR_UPDATE, doc);
    return new WriteResult.Success(id);
  }

  @Override
  public final WriteResult update(T doc, WriteOptions options) {
    Objects.requireNonNull(doc, "doc");
    WriteOptions opts = (options == null) ? WriteOptions.defaults() : options;
    if (doc.id() == null) {
      throw new PreconditionViolationException("update requires a document with an identity, got " + doc.describe());
    }
    if (!doc.isPersisted()) {
      throw new PreconditionViolationException("update requires a persisted document, got " + doc.describe());
    }
    DocumentId id = doc.id();
    long start = System.nanoTime();
    if (opts.validate() && !runValidation(doc)) {
      logWrite("update", id, "invalid", start);
      return new WriteResult.Invalid(doc.errors());
    }

    observers.fire(HookPoint.BEFORE_UPDATE, doc);
    observers.fire(HookPoint.BEFORE_INSERT_OR_UPDATE, doc);

    long matched;
    try {
      matched = executeReplace(id, codec.encode(doc));
    } catch (ConstraintViolationException e) {
      logWrite("update", id, "constraint_violation", start);
      return new WriteResult.ConstraintViolated(e);
    }
    if (matched == 0) {
      throw new PreconditionViolationException("update found no record in '" + collection() + "' for " + doc.describe());
    }
    logWrite("update", id, "ok", start);

    observers.fire(HookPoint.AFTER_UPDATE, doc);
    observers.fire(HookPoint.AFTER_INSERT_OR_UPDATE, doc);
    return new WriteResult.Success(id);
  }

  @Override
  public final WriteResult save(T doc, WriteOptions options) {
    Objects.requireNonNull(doc, "doc");
    if (doc.isNew()) return insert(doc, options);
    if (doc.isPersisted()) return update(doc, options);
    throw new PreconditionViolationException("save of a removed document: " + doc.describe());
  }

  @Override
  public final boolean remove(T doc) {
    Objects.requireNonNull(doc, "doc");
    if (!doc.isPersisted()) {
      throw new PreconditionViolationException("remove requires a persisted document, got " + doc.describe());
    }
    DocumentId id = doc.id();
    long start = System.nanoTime();

    observers.fire(HookPoint.BEFORE_REMOVE, doc);
    long deleted = executeDelete(id);
    doc.markRemoved();
    logWrite("remove", id, deleted > 0 ? "ok" : "missing", start);
    observers.fire(HookPoint.AFTER_REMOVE, doc);
    return deleted > 0;
  }

  @Override
  public final boolean reload(T doc) {
    Objects.requireNonNull(doc, "doc");
    if (!doc.isPersisted()) {
      throw new PreconditionViolationException("reload requires a persisted document, got " + doc.describe());
    }
    Map<String, Object> raw = findRawOne(idFilter(doc.id()));
    if (raw == null) return false;
    T fresh = codec.decode(raw, binding);
    doc.replaceFields(fresh.fields());
    return true;
  }

  // --- Reads ---

  @Override
  public final Optional<T> findOne(Map<String, Object> filter) {
    Map<String, Object> raw = findRawOne(normalize(filter));
    return Optional.ofNullable(codec.decode(raw, binding));
  }

  @Override
  public final Optional<T> findOne(DocumentId id) {
    Objects.requireNonNull(id, "id");
    return findOne(idFilter(id));
  }

  @Override
  public final Cursor<T> find(Map<String, Object> filter, FindOptions options) {
    Map<String, Object> f = normalize(filter);
    FindOptions o = (options == null) ? FindOptions.none() : options;
    return new StoreCursor<>(() -> {
      if (log.isDebugEnabled()) log.debug("docket.repo op=find collection={} filter={} options={}", collection(), f, o);
      return openCursor(f, o);
    }, codec, binding);
  }

  @Override
  public final long count(Map<String, Object> filter) {
    return executeCount(normalize(filter));
  }

  /** Filter on the identity field; the identity's native value is handed to the store. */
  protected Map<String, Object> idFilter(DocumentId id) {
    return Map.of(DocumentCodec.ID_FIELD, id.value());
  }

  private Map<String, Object> findRawOne(Map<String, Object> filter) {
    try (RawCursor c = openCursor(filter, FindOptions.none().limit(1))) {
      return c.hasNext() ? c.next() : null;
    }
  }

  private boolean runValidation(T doc) {
    observers.fire(HookPoint.BEFORE_VALIDATE, doc);
    boolean valid = doc.isValid(expectations);
    observers.fire(HookPoint.AFTER_VALIDATE, doc);
    if (!valid && log.isDebugEnabled()) {
      log.debug("docket.repo validation_failed collection={} doc={} errors={}", collection(), doc.describe(), doc.errors());
    }
    return valid;
  }

  private static Map<String, Object> normalize(Map<String, Object> filter) {
    return (filter == null) ? Map.of() : filter;
  }

  private void logWrite(String op, DocumentId id, String outcome, long startNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("docket.repo op={} collection={} id={} outcome={} durationMs={}",
        op, collection(), id, outcome, (System.nanoTime() - startNanos) / 1_000_000L);
  }

  /** Builds the violation a backend hook throws when the store rejects a write. */
  protected final ConstraintViolationException constraintViolation(String op, DocumentId id, Throwable cause) {
    return new ConstraintViolationException(op, collection(), id, cause);
  }

  // --- Backend-specific hooks ---

  /** Inserts one record (fields only) and returns its identity, generated by the store if needed. */
  protected abstract DocumentId executeInsert(Map<String, Object> fields);

  /** Replaces the record with this identity; returns the number of matched records. */
  protected abstract long executeReplace(DocumentId id, Map<String, Object> fields);

  /** Deletes the record with this identity; returns the number of deleted records. */
  protected abstract long executeDelete(DocumentId id);

  /** Opens a store cursor; records must carry {@code _id}. */
  protected abstract RawCursor openCursor(Map<String, Object> filter, FindOptions options);

  protected abstract long executeCount(Map<String, Object> filter);
}
