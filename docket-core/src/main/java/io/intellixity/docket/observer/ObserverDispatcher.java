package io.intellixity.docket.observer;

import io.intellixity.docket.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/** Fires hook points on the observers registered for one document type, in registration order. */
public final class ObserverDispatcher<T extends Document> {
  private static final Logger log = LoggerFactory.getLogger(ObserverDispatcher.class);

  private final Class<T> type;
  private final List<DocumentObserver<? super T>> observers;

  public ObserverDispatcher(Class<T> type, ObserverRegistry registry) {
    this.type = Objects.requireNonNull(type, "type");
    this.observers = Objects.requireNonNull(registry, "registry").observersFor(type);
  }

  /** Exceptions thrown by an observer propagate immediately; later observers are not called. */
  public void fire(HookPoint point, T doc) {
    Objects.requireNonNull(point, "point");
    for (DocumentObserver<? super T> o : observers) {
      if (log.isTraceEnabled()) {
        log.trace("docket.observer hook={} type={} observer={} doc={}",
            point, type.getSimpleName(), o.getClass().getName(), doc.describe());
      }
      point.fire(o, doc);
    }
  }
}
