package io.intellixity.docket.mongo;

import io.intellixity.docket.value.DocumentId;
import org.bson.BsonInt64;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoValuesTest {

  @Test
  void toBson_unwrapsIdentitiesAndConvertsInstants() {
    ObjectId owner = new ObjectId();
    Instant at = Instant.parse("2024-01-02T03:04:05Z");
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("owner", DocumentId.of(owner));
    raw.put("at", at);
    raw.put("address", Map.of("city", "Oslo"));
    raw.put("history", List.of(at));

    Document bson = MongoValues.toBson(raw);

    assertEquals(owner, bson.get("owner"));
    assertEquals(Date.from(at), bson.get("at"));
    assertInstanceOf(Document.class, bson.get("address"));
    assertEquals("Oslo", ((Document) bson.get("address")).getString("city"));
    assertEquals(List.of(Date.from(at)), bson.get("history"));
  }

  @Test
  void fromBson_producesDocumentFriendlyValues() {
    ObjectId id = new ObjectId();
    Date at = new Date(1_700_000_000_000L);
    Document bson = new Document("_id", id)
        .append("at", at)
        .append("price", new Decimal128(new BigDecimal("9.99")))
        .append("nested", new Document("n", 1))
        .append("tags", List.of("a", new Document("b", true)));

    Map<String, Object> raw = MongoValues.fromBson(bson);

    assertEquals(DocumentId.of(id), raw.get("_id"));
    assertEquals(at.toInstant(), raw.get("at"));
    assertEquals(new BigDecimal("9.99"), raw.get("price"));
    assertEquals(Map.of("n", 1), raw.get("nested"));
    assertEquals(List.of("a", Map.of("b", true)), raw.get("tags"));
    assertFalse(raw.get("nested") instanceof Document);
  }

  @Test
  void bsonToJava_unwrapsInsertedIds() {
    ObjectId id = new ObjectId();
    assertEquals(id, MongoValues.bsonToJava(new BsonObjectId(id)));
    assertEquals("k1", MongoValues.bsonToJava(new BsonString("k1")));
    assertEquals(7L, MongoValues.bsonToJava(new BsonInt64(7)));
    assertNull(MongoValues.bsonToJava(null));
  }
}
