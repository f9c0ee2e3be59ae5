package io.intellixity.docket.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.result.InsertOneResult;
import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.CollectionBinding;
import io.intellixity.docket.exec.FindOptions;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.spi.exec.AbstractRepository;
import io.intellixity.docket.spi.exec.RawCursor;
import io.intellixity.docket.spi.mapping.DocumentCodec;
import io.intellixity.docket.validation.expect.ExpectationRegistry;
import io.intellixity.docket.value.DocumentId;
import org.bson.conversions.Bson;

import java.util.Map;
import java.util.Objects;

/**
 * Repository backed by one Mongo collection, using the official MongoDB Java sync driver.
 * <p>
 * Filters are Mongo query documents given as maps; they reach the driver unchanged apart from value
 * conversion. Duplicate-key errors surface as constraint violations; other driver exceptions propagate.
 */
public final class MongoRepository<T extends Document> extends AbstractRepository<T> {
  private final MongoCollection<org.bson.Document> col;

  public MongoRepository(MongoHandle handle,
                         CollectionBinding<T> binding,
                         ObserverRegistry observers,
                         ExpectationRegistry expectations) {
    super(binding, observers, expectations, new DocumentCodec());
    this.col = Objects.requireNonNull(handle, "handle").database().getCollection(binding.collection());
  }

  @Override
  protected DocumentId executeInsert(Map<String, Object> fields) {
    org.bson.Document doc = MongoValues.toBson(fields);
    InsertOneResult r;
    try {
      r = col.insertOne(doc);
    } catch (RuntimeException e) {
      if (MongoErrors.isDuplicateKey(e)) throw constraintViolation("insert", null, e);
      throw e;
    }
    Object id = (r.getInsertedId() == null) ? doc.get(DocumentCodec.ID_FIELD) : MongoValues.bsonToJava(r.getInsertedId());
    return (id == null) ? null : DocumentId.of(id);
  }

  @Override
  protected long executeReplace(DocumentId id, Map<String, Object> fields) {
    try {
      return col.replaceOne(byId(id), MongoValues.toBson(fields)).getMatchedCount();
    } catch (RuntimeException e) {
      if (MongoErrors.isDuplicateKey(e)) throw constraintViolation("update", id, e);
      throw e;
    }
  }

  @Override
  protected long executeDelete(DocumentId id) {
    return col.deleteOne(byId(id)).getDeletedCount();
  }

  @Override
  protected RawCursor openCursor(Map<String, Object> filter, FindOptions options) {
    FindIterable<org.bson.Document> find = col.find(MongoValues.toBson(filter));
    if (!options.sort().isEmpty()) find = find.sort(MongoValues.toBson(options.sort()));
    if (options.skip() != null) find = find.skip(options.skip());
    if (options.limit() != null) find = find.limit(options.limit());
    return new MongoRawCursor(find.iterator());
  }

  @Override
  protected long executeCount(Map<String, Object> filter) {
    return col.countDocuments(MongoValues.toBson(filter));
  }

  private static Bson byId(DocumentId id) {
    return Filters.eq(DocumentCodec.ID_FIELD, id.value());
  }
}
