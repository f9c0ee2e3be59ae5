package io.intellixity.docket.observer;

import io.intellixity.docket.document.Document;

import java.util.*;

/**
 * Maps document types to their ordered observers.
 * <p>
 * Built once at model initialization and immutable afterwards; registration order is call order.
 * Lookup is by exact document class.
 */
public final class ObserverRegistry {
  private static final ObserverRegistry EMPTY = new ObserverRegistry(Map.of());

  private final Map<Class<?>, List<DocumentObserver<?>>> byType;

  private ObserverRegistry(Map<Class<?>, List<DocumentObserver<?>>> byType) {
    this.byType = byType;
  }

  public static ObserverRegistry empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  @SuppressWarnings("unchecked")
  public <T extends Document> List<DocumentObserver<? super T>> observersFor(Class<T> type) {
    Objects.requireNonNull(type, "type");
    List<DocumentObserver<?>> l = byType.get(type);
    if (l == null) return List.of();
    List<DocumentObserver<? super T>> out = new ArrayList<>(l.size());
    for (DocumentObserver<?> o : l) out.add((DocumentObserver<? super T>) o);
    return Collections.unmodifiableList(out);
  }

  public Set<Class<?>> observedTypes() {
    return byType.keySet();
  }

  public static final class Builder {
    private final Map<Class<?>, List<DocumentObserver<?>>> byType = new LinkedHashMap<>();

    private Builder() {}

    public <T extends Document> Builder register(Class<T> type, DocumentObserver<? super T> observer) {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(observer, "observer");
      byType.computeIfAbsent(type, k -> new ArrayList<>()).add(observer);
      return this;
    }

    public ObserverRegistry build() {
      Map<Class<?>, List<DocumentObserver<?>>> m = new LinkedHashMap<>();
      byType.forEach((k, v) -> m.put(k, List.copyOf(v)));
      return new ObserverRegistry(Collections.unmodifiableMap(m));
    }
  }
}
