package io.intellixity.docket.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.docket.document.Document;

import java.io.IOException;

/** Writes a document as one JSON object: {@code _id} first (when assigned), then its fields in order. */
public final class DocumentJsonSerializer extends JsonSerializer<Document> {
  public static final String ID_FIELD = Document.ID_FIELD;

  @Override
  public void serialize(Document doc, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (doc == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    if (doc.id() != null) g.writeStringField(ID_FIELD, doc.id().toString());
    for (var e : doc.fields().entrySet()) {
      g.writeFieldName(e.getKey());
      DocValueJsonSerializer.write(e.getValue(), g);
    }
    g.writeEndObject();
  }

  @Override
  public Class<Document> handledType() {
    return Document.class;
  }
}
