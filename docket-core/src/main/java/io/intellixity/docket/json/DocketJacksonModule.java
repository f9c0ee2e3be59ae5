package io.intellixity.docket.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.intellixity.docket.document.Document;
import io.intellixity.docket.value.DocValue;

/** Jackson module for documents and document values. Register it on any ObjectMapper. */
public final class DocketJacksonModule extends SimpleModule {
  public DocketJacksonModule() {
    super("docket");
    addSerializer(DocValue.class, new DocValueJsonSerializer());
    addSerializer(Document.class, new DocumentJsonSerializer());
    addDeserializer(DocValue.class, new DocValueJsonDeserializer());
  }
}
