package io.intellixity.docket.spi.memory;

import io.intellixity.docket.exec.FindOptions;
import io.intellixity.docket.spi.mapping.DocumentCodec;
import io.intellixity.docket.value.DocumentId;

import java.math.BigDecimal;
import java.util.*;

/**
 * One collection of raw records held in memory.
 * <p>
 * Records are deep-copied on the way in and out. Filters support equality on (dotted) field paths only;
 * an array field matches when any of its elements is equal to the expected value.
 */
public final class InMemoryCollection {
  private final String name;
  private final LinkedHashMap<Object, Map<String, Object>> records = new LinkedHashMap<>();
  private final Set<String> uniqueFields = new LinkedHashSet<>();

  InMemoryCollection(String name) {
    this.name = name;
  }

  public String name() { return name; }

  /**
   * Enforces uniqueness of a field from now on, as a Mongo unique index does: a missing field counts as
   * null, so at most one record may lack it.
   */
  public synchronized void ensureUniqueIndex(String field) {
    Objects.requireNonNull(field, "field");
    Set<Object> seen = new HashSet<>();
    for (Map<String, Object> r : records.values()) {
      Object v = comparable(resolve(r, field));
      if (!seen.add(v)) throw new DuplicateKeyException(name, field, v);
    }
    uniqueFields.add(field);
  }

  /** Stores a record and returns its generated identity value. */
  public synchronized Object insert(Map<String, Object> fields) {
    Object id = UUID.randomUUID().toString();
    Map<String, Object> record = copyMap(fields);
    record.remove(DocumentCodec.ID_FIELD);
    checkUnique(null, record);
    record.put(DocumentCodec.ID_FIELD, id);
    records.put(id, record);
    return id;
  }

  /** Replaces the record with this identity; returns 0 when none exists. */
  public synchronized long replace(Object id, Map<String, Object> fields) {
    Object key = unwrap(id);
    if (!records.containsKey(key)) return 0;
    Map<String, Object> record = copyMap(fields);
    record.remove(DocumentCodec.ID_FIELD);
    checkUnique(key, record);
    record.put(DocumentCodec.ID_FIELD, key);
    records.put(key, record);
    return 1;
  }

  public synchronized long delete(Object id) {
    return records.remove(unwrap(id)) == null ? 0 : 1;
  }

  public synchronized List<Map<String, Object>> find(Map<String, Object> filter, FindOptions options) {
    List<Map<String, Object>> hits = new ArrayList<>();
    for (Map<String, Object> r : records.values()) {
      if (matches(r, filter)) hits.add(r);
    }
    if (!options.sort().isEmpty()) hits.sort(comparator(options.sort()));
    int from = options.skip() == null ? 0 : Math.min(options.skip(), hits.size());
    int to = options.limit() == null ? hits.size() : Math.min(hits.size(), from + options.limit());
    List<Map<String, Object>> out = new ArrayList<>(to - from);
    for (Map<String, Object> r : hits.subList(from, to)) out.add(copyMap(r));
    return out;
  }

  public synchronized long count(Map<String, Object> filter) {
    long n = 0;
    for (Map<String, Object> r : records.values()) {
      if (matches(r, filter)) n++;
    }
    return n;
  }

  private void checkUnique(Object selfId, Map<String, Object> candidate) {
    for (String field : uniqueFields) {
      Object v = comparable(resolve(candidate, field));
      for (Map.Entry<Object, Map<String, Object>> e : records.entrySet()) {
        if (e.getKey().equals(selfId)) continue;
        if (Objects.equals(v, comparable(resolve(e.getValue(), field)))) {
          throw new DuplicateKeyException(name, field, v);
        }
      }
    }
  }

  // --- matching ---

  private static boolean matches(Map<String, Object> record, Map<String, Object> filter) {
    for (Map.Entry<String, Object> e : filter.entrySet()) {
      String path = e.getKey();
      if (path.startsWith("$") || isOperatorMap(e.getValue())) {
        throw new UnsupportedOperationException("In-memory store supports equality filters only: " + path);
      }
      if (!valueMatches(resolve(record, path), e.getValue())) return false;
    }
    return true;
  }

  private static boolean isOperatorMap(Object v) {
    if (!(v instanceof Map<?, ?> m)) return false;
    for (Object k : m.keySet()) {
      if (k instanceof String s && s.startsWith("$")) return true;
    }
    return false;
  }

  private static boolean valueMatches(Object actual, Object expected) {
    if (actual instanceof List<?> list && !(expected instanceof List<?>)) {
      for (Object item : list) {
        if (equal(item, expected)) return true;
      }
      return false;
    }
    return equal(actual, expected);
  }

  private static boolean equal(Object a, Object b) {
    return Objects.equals(comparable(a), comparable(b));
  }

  /**
   * Normalizes numbers and identities so that {@code 1}, {@code 1L} and {@code 1.0} compare equal.
   * NaN and infinities stay boxed doubles.
   */
  private static Object comparable(Object v) {
    Object u = unwrap(v);
    if (u instanceof Double || u instanceof Float) {
      double d = ((Number) u).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) return d;
    }
    if (u instanceof Number n) {
      BigDecimal d = (n instanceof BigDecimal bd) ? bd : new BigDecimal(n.toString());
      return d.stripTrailingZeros();
    }
    if (u instanceof Map<?, ?> m) {
      Map<Object, Object> out = new LinkedHashMap<>();
      m.forEach((k, val) -> out.put(k, comparable(val)));
      return out;
    }
    if (u instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(comparable(o));
      return out;
    }
    return u;
  }

  private static Object unwrap(Object v) {
    return (v instanceof DocumentId id) ? id.value() : v;
  }

  private static Object resolve(Map<String, Object> record, String path) {
    Object cur = record;
    for (String part : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(part);
    }
    return cur;
  }

  // --- sorting ---

  private static Comparator<Map<String, Object>> comparator(Map<String, Integer> sort) {
    Comparator<Map<String, Object>> c = null;
    for (Map.Entry<String, Integer> e : sort.entrySet()) {
      String path = e.getKey();
      Comparator<Map<String, Object>> next = (a, b) -> compareValues(resolve(a, path), resolve(b, path));
      if (e.getValue() < 0) next = next.reversed();
      c = (c == null) ? next : c.thenComparing(next);
    }
    return c;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compareValues(Object a, Object b) {
    Object x = comparable(a);
    Object y = comparable(b);
    if (x == null || y == null) return (x == null) ? (y == null ? 0 : -1) : 1;
    if (x.getClass() == y.getClass() && x instanceof Comparable cx) return cx.compareTo(y);
    return x.getClass().getName().compareTo(y.getClass().getName());
  }

  // --- copying ---

  private static Map<String, Object> copyMap(Map<String, ?> src) {
    Map<String, Object> out = new LinkedHashMap<>();
    src.forEach((k, v) -> out.put(k, copy(v)));
    return out;
  }

  @SuppressWarnings("unchecked")
  private static Object copy(Object v) {
    if (v instanceof Map<?, ?> m) return copyMap((Map<String, ?>) m);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(copy(o));
      return out;
    }
    return v;
  }
}
