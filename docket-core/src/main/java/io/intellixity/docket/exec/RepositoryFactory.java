package io.intellixity.docket.exec;

import io.intellixity.docket.document.Document;

import java.util.function.Supplier;

/** Creates repositories against one store, sharing its connection and registries. */
public interface RepositoryFactory {
  <T extends Document> Repository<T> create(CollectionBinding<T> binding);

  default <T extends Document> Repository<T> create(Class<T> type, Supplier<T> factory) {
    return create(CollectionBinding.of(type, factory));
  }
}
