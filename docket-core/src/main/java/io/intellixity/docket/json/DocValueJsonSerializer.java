package io.intellixity.docket.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.docket.value.DocValue;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/** Writes a {@link DocValue} as plain JSON. Identities and timestamps are written as strings. */
public final class DocValueJsonSerializer extends JsonSerializer<DocValue> {
  @Override
  public void serialize(DocValue v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    write(v, g);
  }

  static void write(DocValue v, JsonGenerator g) throws IOException {
    if (v == null || v.isNull()) {
      g.writeNull();
      return;
    }
    if (v instanceof DocValue.Text t) {
      g.writeString(t.value());
      return;
    }
    if (v instanceof DocValue.Bool b) {
      g.writeBoolean(b.value());
      return;
    }
    if (v instanceof DocValue.Num n) {
      writeNumber(n.value(), g);
      return;
    }
    if (v instanceof DocValue.Time t) {
      g.writeString(t.value().toString());
      return;
    }
    if (v instanceof DocValue.Ident id) {
      g.writeString(id.id().toString());
      return;
    }
    if (v instanceof DocValue.Seq s) {
      g.writeStartArray();
      for (DocValue x : s.items()) write(x, g);
      g.writeEndArray();
      return;
    }
    DocValue.Tree tree = (DocValue.Tree) v;
    g.writeStartObject();
    for (var e : tree.entries().entrySet()) {
      g.writeFieldName(e.getKey());
      write(e.getValue(), g);
    }
    g.writeEndObject();
  }

  private static void writeNumber(Number n, JsonGenerator g) throws IOException {
    if (n instanceof Integer || n instanceof Short || n instanceof Byte) g.writeNumber(n.intValue());
    else if (n instanceof Long l) g.writeNumber(l);
    else if (n instanceof BigDecimal bd) g.writeNumber(bd);
    else if (n instanceof BigInteger bi) g.writeNumber(bi);
    else if (n instanceof Float f) g.writeNumber(f);
    else g.writeNumber(n.doubleValue());
  }
}
