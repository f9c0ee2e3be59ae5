package io.intellixity.docket.mongo;

import io.intellixity.docket.value.DocumentId;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw record values to and from BSON-friendly Java values.
 * <p>
 * Outbound: identities are unwrapped to their native value, instants become {@link Date}s and maps become
 * {@link Document}s. Inbound: {@link ObjectId}s become identities, dates become instants and
 * {@link Decimal128} becomes {@link java.math.BigDecimal}.
 */
final class MongoValues {
  private MongoValues() {}

  static Document toBson(Map<String, ?> raw) {
    Document out = new Document();
    if (raw != null) raw.forEach((k, v) -> out.put(k, toBsonValue(v)));
    return out;
  }

  @SuppressWarnings("unchecked")
  static Object toBsonValue(Object v) {
    if (v == null) return null;
    if (v instanceof DocumentId id) return id.value();
    if (v instanceof Instant i) return Date.from(i);
    if (v instanceof Map<?, ?> m) return toBson((Map<String, ?>) m);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toBsonValue(o));
      return out;
    }
    return v;
  }

  static Map<String, Object> fromBson(Document doc) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (doc != null) doc.forEach((k, v) -> out.put(k, fromBsonValue(v)));
    return out;
  }

  static Object fromBsonValue(Object v) {
    if (v == null) return null;
    if (v instanceof ObjectId oid) return DocumentId.of(oid);
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Decimal128 dec) return dec.bigDecimalValue();
    if (v instanceof Document d) return fromBson(d);
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      m.forEach((k, x) -> out.put(String.valueOf(k), fromBsonValue(x)));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(fromBsonValue(o));
      return out;
    }
    return v;
  }

  static Object bsonToJava(BsonValue v) {
    if (v == null) return null;
    if (v.isObjectId()) return v.asObjectId().getValue();
    if (v.isString()) return v.asString().getValue();
    if (v.isInt32()) return v.asInt32().getValue();
    if (v.isInt64()) return v.asInt64().getValue();
    if (v.isBoolean()) return v.asBoolean().getValue();
    return v.toString();
  }
}
