package io.intellixity.docket.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import io.intellixity.docket.exec.handle.StoreHandle;

import java.util.Objects;

/** Mongo store handle (resolved by application code). */
public final class MongoHandle implements StoreHandle<MongoClient> {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoHandle(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override public String id() { return id; }
  @Override public MongoClient client() { return client; }
  @Override public String namespace() { return database; }

  public MongoDatabase database() {
    return client.getDatabase(database);
  }
}
