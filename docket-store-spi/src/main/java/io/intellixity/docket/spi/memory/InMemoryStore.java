package io.intellixity.docket.spi.memory;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.CollectionBinding;
import io.intellixity.docket.exec.Repository;
import io.intellixity.docket.exec.RepositoryFactory;
import io.intellixity.docket.observer.ObserverRegistry;
import io.intellixity.docket.validation.expect.ExpectationRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for tests and embedded use. Collections are created on first access.
 */
public final class InMemoryStore implements RepositoryFactory {
  private final Map<String, InMemoryCollection> collections = new ConcurrentHashMap<>();
  private final ObserverRegistry observers;
  private final ExpectationRegistry expectations;

  public InMemoryStore() {
    this(ObserverRegistry.empty(), ExpectationRegistry.defaults());
  }

  public InMemoryStore(ObserverRegistry observers) {
    this(observers, ExpectationRegistry.defaults());
  }

  public InMemoryStore(ObserverRegistry observers, ExpectationRegistry expectations) {
    this.observers = Objects.requireNonNull(observers, "observers");
    this.expectations = Objects.requireNonNull(expectations, "expectations");
  }

  public InMemoryCollection collection(String name) {
    return collections.computeIfAbsent(name, InMemoryCollection::new);
  }

  public InMemoryStore ensureUniqueIndex(String collection, String field) {
    collection(collection).ensureUniqueIndex(field);
    return this;
  }

  @Override
  public <T extends Document> Repository<T> create(CollectionBinding<T> binding) {
    return new InMemoryRepository<>(binding, collection(binding.collection()), observers, expectations);
  }
}
