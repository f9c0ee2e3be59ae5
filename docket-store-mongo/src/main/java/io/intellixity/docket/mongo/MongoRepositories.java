package io.intellixity.docket.mongo;

import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.CollectionBinding;
import io.intellixity.docket.exec.Repository;
import io.intellixity.docket.exec.RepositoryFactory;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.validation.expect.ExpectationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Creates {@link MongoRepository} instances sharing one handle and one set of registries. */
public final class MongoRepositories implements RepositoryFactory {
  private static final Logger log = LoggerFactory.getLogger(MongoRepositories.class);

  private final MongoHandle handle;
  private final ObserverRegistry observers;
  private final ExpectationRegistry expectations;

  public MongoRepositories(MongoHandle handle, ObserverRegistry observers) {
    this(handle, observers, ExpectationRegistry.defaults());
  }

  public MongoRepositories(MongoHandle handle, ObserverRegistry observers, ExpectationRegistry expectations) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.observers = Objects.requireNonNull(observers, "observers");
    this.expectations = Objects.requireNonNull(expectations, "expectations");
  }

  @Override
  public <T extends Document> Repository<T> create(CollectionBinding<T> binding) {
    return new MongoRepository<>(handle, binding, observers, expectations);
  }

  /** Creates an ascending unique index on a field (idempotent on the server). */
  public String ensureUniqueIndex(String collection, String field) {
    String name = handle.database().getCollection(collection)
        .createIndex(Indexes.ascending(field), new IndexOptions().unique(true));
    log.info("docket.mongo unique_index handle={} collection={} field={} name={}", handle.id(), collection, field, name);
    return name;
  }
}
