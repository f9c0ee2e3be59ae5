package io.intellixity.docket.value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged value stored in a document field.
 * <p>
 * Every field of a {@code Document} holds exactly one of these variants. Values are immutable; nested
 * trees and sequences are copied on construction.
 */
public sealed interface DocValue {
  DocValue NULL = Null.INSTANCE;

  /** Plain Java view of this value (String, Number, Boolean, Instant, DocumentId, List, Map or null). */
  Object toJava();

  default boolean isNull() {
    return this == NULL;
  }

  enum Null implements DocValue {
    INSTANCE;

    @Override public Object toJava() { return null; }
    @Override public String toString() { return "null"; }
  }

  record Text(String value) implements DocValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override public Object toJava() { return value; }
  }

  record Num(Number value) implements DocValue {
    public Num {
      Objects.requireNonNull(value, "value");
    }

    @Override public Object toJava() { return value; }
  }

  record Bool(boolean value) implements DocValue {
    public static final Bool TRUE = new Bool(true);
    public static final Bool FALSE = new Bool(false);

    @Override public Object toJava() { return value; }
  }

  record Time(Instant value) implements DocValue {
    public Time {
      Objects.requireNonNull(value, "value");
    }

    @Override public Object toJava() { return value; }
  }

  record Ident(DocumentId id) implements DocValue {
    public Ident {
      Objects.requireNonNull(id, "id");
    }

    @Override public Object toJava() { return id; }
  }

  record Seq(List<DocValue> items) implements DocValue {
    public Seq {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public Object toJava() {
      List<Object> out = new ArrayList<>(items.size());
      for (DocValue v : items) out.add(v.toJava());
      return out;
    }
  }

  /** Nested mapping; key order is preserved. */
  record Tree(Map<String, DocValue> entries) implements DocValue {
    public Tree {
      Objects.requireNonNull(entries, "entries");
      Map<String, DocValue> copy = new LinkedHashMap<>();
      for (var e : entries.entrySet()) {
        copy.put(Objects.requireNonNull(e.getKey(), "key"), e.getValue() == null ? NULL : e.getValue());
      }
      entries = Collections.unmodifiableMap(copy);
    }

    public static Tree empty() {
      return new Tree(Map.of());
    }

    public DocValue get(String key) {
      DocValue v = entries.get(key);
      return v == null ? NULL : v;
    }

    public Tree with(String key, DocValue value) {
      Map<String, DocValue> m = new LinkedHashMap<>(entries);
      m.put(key, value);
      return new Tree(m);
    }

    public Tree without(String key) {
      if (!entries.containsKey(key)) return this;
      Map<String, DocValue> m = new LinkedHashMap<>(entries);
      m.remove(key);
      return new Tree(m);
    }

    @Override
    public Object toJava() {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : entries.entrySet()) out.put(e.getKey(), e.getValue().toJava());
      return out;
    }
  }
}
