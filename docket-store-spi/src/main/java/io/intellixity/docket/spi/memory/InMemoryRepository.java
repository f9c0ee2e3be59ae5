package io.intellixity.docket.spi.memory;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.CollectionBinding;
import io.intellixity.docket.exec.FindOptions;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.spi.exec.AbstractRepository;
import io.intellixity.docket.spi.exec.RawCursor;
import io.intellixity.docket.spi.mapping.DocumentCodec;
import io.intellixity.docket.validation.expect.ExpectationRegistry;
import io.intellixity.docket.value.DocumentId;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

final class InMemoryRepository<T extends Document> extends AbstractRepository<T> {
  private final InMemoryCollection records;

  InMemoryRepository(CollectionBinding<T> binding, InMemoryCollection records,
                     ObserverRegistry observers, ExpectationRegistry expectations) {
    super(binding, observers, expectations, new DocumentCodec());
    this.records = records;
  }

  @Override
  protected DocumentId executeInsert(Map<String, Object> fields) {
    try {
      return DocumentId.of(records.insert(fields));
    } catch (DuplicateKeyException e) {
      throw constraintViolation("insert", null, e);
    }
  }

  @Override
  protected long executeReplace(DocumentId id, Map<String, Object> fields) {
    try {
      return records.replace(id.value(), fields);
    } catch (DuplicateKeyException e) {
      throw constraintViolation("update", id, e);
    }
  }

  @Override
  protected long executeDelete(DocumentId id) {
    return records.delete(id.value());
  }

  @Override
  protected RawCursor openCursor(Map<String, Object> filter, FindOptions options) {
    List<Map<String, Object>> hits = records.find(filter, options);
    Iterator<Map<String, Object>> it = hits.iterator();
    return new RawCursor() {
      @Override public boolean hasNext() { return it.hasNext(); }
      @Override public Map<String, Object> next() { return it.next(); }
      @Override public void close() {}
    };
  }

  @Override
  protected long executeCount(Map<String, Object> filter) {
    return records.count(filter);
  }
}
