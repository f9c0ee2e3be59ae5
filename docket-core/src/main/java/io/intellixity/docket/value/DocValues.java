package io.intellixity.docket.value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions between plain Java values and {@link DocValue}. */
public final class DocValues {
  private DocValues() {}

  public static DocValue of(Object raw) {
    if (raw == null) return DocValue.NULL;
    if (raw instanceof DocValue v) return v;
    if (raw instanceof String s) return new DocValue.Text(s);
    if (raw instanceof Character c) return new DocValue.Text(String.valueOf(c));
    if (raw instanceof Boolean b) return b ? DocValue.Bool.TRUE : DocValue.Bool.FALSE;
    if (raw instanceof Number n) return new DocValue.Num(n);
    if (raw instanceof Instant i) return new DocValue.Time(i);
    if (raw instanceof Date d) return new DocValue.Time(d.toInstant());
    if (raw instanceof DocumentId id) return new DocValue.Ident(id);
    if (raw instanceof Enum<?> e) return new DocValue.Text(e.name());
    if (raw instanceof Map<?, ?> m) {
      Map<String, DocValue> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), of(e.getValue()));
      return new DocValue.Tree(out);
    }
    if (raw instanceof Iterable<?> it) {
      List<DocValue> out = new ArrayList<>();
      for (Object o : it) out.add(of(o));
      return new DocValue.Seq(out);
    }
    if (raw instanceof Object[] a) return of(Arrays.asList(a));
    throw new IllegalArgumentException("Unsupported document value type: " + raw.getClass().getName());
  }

  /** Converts every entry of a raw record; keys keep their order. */
  public static Map<String, DocValue> ofMap(Map<String, ?> raw) {
    Map<String, DocValue> out = new LinkedHashMap<>();
    if (raw == null) return out;
    for (var e : raw.entrySet()) out.put(e.getKey(), of(e.getValue()));
    return out;
  }

  public static Map<String, Object> toJava(Map<String, DocValue> fields) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : fields.entrySet()) out.put(e.getKey(), e.getValue().toJava());
    return out;
  }

  /** True for null, the empty string and empty sequences or trees. */
  public static boolean isBlank(DocValue v) {
    if (v == null || v.isNull()) return true;
    if (v instanceof DocValue.Text t) return t.value().isEmpty();
    if (v instanceof DocValue.Seq s) return s.items().isEmpty();
    if (v instanceof DocValue.Tree t) return t.entries().isEmpty();
    return false;
  }

  /** True for numbers and for text that parses as a decimal number. */
  public static boolean isNumeric(DocValue v) {
    if (v instanceof DocValue.Num) return true;
    if (!(v instanceof DocValue.Text t)) return false;
    String s = t.value().trim();
    if (s.isEmpty()) return false;
    try {
      new BigDecimal(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  /** Length of text, sequence or tree; other scalars measure their textual form; null has length 0. */
  public static int length(DocValue v) {
    if (v == null || v.isNull()) return 0;
    if (v instanceof DocValue.Text t) return t.value().length();
    if (v instanceof DocValue.Seq s) return s.items().size();
    if (v instanceof DocValue.Tree t) return t.entries().size();
    return String.valueOf(v.toJava()).length();
  }

  /** Textual form used for pattern matching, or null for null values and containers. */
  public static String textOrNull(DocValue v) {
    if (v == null || v.isNull()) return null;
    if (v instanceof DocValue.Text t) return t.value();
    if (v instanceof DocValue.Seq || v instanceof DocValue.Tree) return null;
    if (v instanceof DocValue.Time t) return t.value().toString();
    return String.valueOf(v.toJava());
  }
}
