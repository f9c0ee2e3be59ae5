package io.intellixity.docket.mongo;

import com.mongodb.client.MongoCursor;
import io.intellixity.docket.spi.exec.RawCursor;
import org.bson.Document;

import java.util.Map;
import java.util.Objects;

final class MongoRawCursor implements RawCursor {
  private final MongoCursor<Document> cursor;

  MongoRawCursor(MongoCursor<Document> cursor) {
    this.cursor = Objects.requireNonNull(cursor, "cursor");
  }

  @Override
  public boolean hasNext() {
    return cursor.hasNext();
  }

  @Override
  public Map<String, Object> next() {
    return MongoValues.fromBson(cursor.next());
  }

  @Override
  public void close() {
    cursor.close();
  }
}
