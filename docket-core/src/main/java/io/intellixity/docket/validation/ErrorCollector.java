package io.intellixity.docket.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered (field, message) failures of one validation pass. Empty means the pass succeeded.
 */
public final class ErrorCollector implements Iterable<FieldError> {
  private final List<FieldError> entries = new ArrayList<>();

  public ErrorCollector add(String field, String message) {
    entries.add(new FieldError(field, message));
    return this;
  }

  /** Adds an error that is not tied to a field. */
  public ErrorCollector add(String message) {
    return add(null, message);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public List<FieldError> entries() {
    return Collections.unmodifiableList(entries);
  }

  /** Messages recorded for {@code field}, in insertion order. */
  public List<String> on(String field) {
    List<String> out = new ArrayList<>();
    for (FieldError e : entries) {
      if (field == null ? e.field() == null : field.equals(e.field())) out.add(e.message());
    }
    return out;
  }

  /** {@code "<field> <message>"} per entry, e.g. {@code "name can't be empty"}. */
  public List<String> fullMessages() {
    return fullMessages(" ");
  }

  public List<String> fullMessages(String separator) {
    List<String> out = new ArrayList<>(entries.size());
    for (FieldError e : entries) out.add(e.fullMessage(separator));
    return out;
  }

  @Override
  public Iterator<FieldError> iterator() {
    return entries().iterator();
  }

  @Override
  public String toString() {
    return String.join(", ", fullMessages());
  }
}
