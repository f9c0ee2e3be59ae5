package io.intellixity.docket.spi.exec;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.exec.CollectionBinding;
import io.intellixity.docket.exec.Cursor;
import io.intellixity.docket.spi.mapping.DocumentCodec;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** {@link Cursor} that opens its {@link RawCursor} on the first {@link #next()} and decodes per record. */
final class StoreCursor<T extends Document> implements Cursor<T> {
  private final Supplier<RawCursor> opener;
  private final DocumentCodec codec;
  private final CollectionBinding<T> binding;

  private RawCursor raw;
  private boolean exhausted;

  StoreCursor(Supplier<RawCursor> opener, DocumentCodec codec, CollectionBinding<T> binding) {
    this.opener = Objects.requireNonNull(opener, "opener");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.binding = Objects.requireNonNull(binding, "binding");
  }

  @Override
  public T next() {
    if (exhausted) return null;
    if (raw == null) raw = Objects.requireNonNull(opener.get(), "raw cursor");
    if (!raw.hasNext()) {
      close();
      return null;
    }
    Map<String, Object> record = raw.next();
    return codec.decode(record, binding);
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() {
    if (exhausted) return;
    exhausted = true;
    if (raw != null) raw.close();
  }
}
