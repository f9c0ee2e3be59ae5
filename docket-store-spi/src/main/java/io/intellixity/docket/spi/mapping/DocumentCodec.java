package io.intellixity.docket.spi.mapping;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.CollectionBinding;
import io.intellixity.docket.value.DocValues;
import io.intellixity.docket.value.DocumentId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between documents and raw records.
 * <p>
 * Raw records are maps of plain Java values (the {@code DocValue.toJava()} shapes); the identity travels
 * under {@link #ID_FIELD} and never appears among a document's fields.
 */
public final class DocumentCodec {
  public static final String ID_FIELD = Document.ID_FIELD;

  /** Fields only; the identity is addressed separately by the store. */
  public Map<String, Object> encode(Document doc) {
    return DocValues.toJava(doc.fields());
  }

  /** Materializes a {@code PERSISTED} instance of the bound type. */
  public <T extends Document> T decode(Map<String, Object> raw, CollectionBinding<T> binding) {
    if (raw == null) return null;
    Object rawId = raw.get(ID_FIELD);
    if (rawId == null) {
      throw new IllegalStateException("Stored record in '" + binding.collection() + "' has no " + ID_FIELD);
    }
    T doc = binding.newInstance();
    doc.load(DocumentId.of(rawId), DocValues.ofMap(fieldsOf(raw)));
    return doc;
  }

  /** Raw record without its identity entry. */
  public Map<String, Object> fieldsOf(Map<String, Object> raw) {
    Map<String, Object> fields = new LinkedHashMap<>(raw);
    fields.remove(ID_FIELD);
    return fields;
  }
}
