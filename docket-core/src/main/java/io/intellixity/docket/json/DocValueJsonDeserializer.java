package io.intellixity.docket.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.docket.value.DocValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads arbitrary JSON into a {@link DocValue}; strings stay text (no timestamp or identity sniffing). */
public final class DocValueJsonDeserializer extends JsonDeserializer<DocValue> {
  @Override
  public DocValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    return fromNode(root);
  }

  @Override
  public DocValue getNullValue(DeserializationContext ctxt) {
    return DocValue.NULL;
  }

  static DocValue fromNode(JsonNode n) {
    if (n == null || n.isNull() || n.isMissingNode()) return DocValue.NULL;
    if (n.isTextual()) return new DocValue.Text(n.asText());
    if (n.isBoolean()) return n.booleanValue() ? DocValue.Bool.TRUE : DocValue.Bool.FALSE;
    if (n.isNumber()) return new DocValue.Num(n.numberValue());
    if (n.isArray()) {
      List<DocValue> items = new ArrayList<>(n.size());
      for (JsonNode x : n) items.add(fromNode(x));
      return new DocValue.Seq(items);
    }
    if (n.isObject()) {
      Map<String, DocValue> m = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = n.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        m.put(e.getKey(), fromNode(e.getValue()));
      }
      return new DocValue.Tree(m);
    }
    throw new IllegalArgumentException("Unsupported JSON node: " + n.getNodeType());
  }
}
