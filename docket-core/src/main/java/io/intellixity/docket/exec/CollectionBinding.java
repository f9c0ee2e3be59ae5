package io.intellixity.docket.exec;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.document.DocumentCollection;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Binds a document type to one logical collection, with the factory used to materialize stored records.
 */
public record CollectionBinding<T extends Document>(Class<T> type, String collection, Supplier<T> factory) {
  public CollectionBinding {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(factory, "factory");
    if (collection == null || collection.isBlank()) throw new IllegalArgumentException("collection is required");
  }

  /** Uses {@link DocumentCollection} if present, else the lower-cased simple class name plus {@code s}. */
  public static <T extends Document> CollectionBinding<T> of(Class<T> type, Supplier<T> factory) {
    return new CollectionBinding<>(type, defaultCollectionName(type), factory);
  }

  public static String defaultCollectionName(Class<?> type) {
    DocumentCollection dc = type.getAnnotation(DocumentCollection.class);
    if (dc != null && !dc.value().isBlank()) return dc.value();
    return type.getSimpleName().toLowerCase(Locale.ROOT) + "s";
  }

  public T newInstance() {
    T doc = factory.get();
    if (doc == null) throw new IllegalStateException("Factory for " + type.getName() + " returned null");
    if (doc.getClass() != type) {
      throw new IllegalStateException("Factory for " + type.getName() + " produced " + doc.getClass().getName());
    }
    return doc;
  }
}
