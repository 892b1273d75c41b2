package com.flamingo.richtext.service.editor;

import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.service.addressing.AddressResolver;
import com.flamingo.richtext.service.concurrency.ConcurrencyController;
import com.flamingo.richtext.service.history.DocumentSnapshotCodec;
import com.flamingo.richtext.service.history.HistoryManager;
import com.flamingo.richtext.service.history.HistorySnapshot;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.Getter;

/**
 * Editing context of one document: the tree, its address bindings, history and concurrency state.
 *
 * <p>Mutations run under the write lock, so the whole cache-check to cache-store pipeline is
 * indivisible per document. Renders and exports run under the read lock and never observe a
 * half-applied edit. Sessions share nothing with each other.
 */
@Getter
public class EditorSession {

  private final String sessionId;
  private final AddressResolver resolver = new AddressResolver();
  private final HistoryManager history;
  private final ConcurrencyController<EditorResponse> concurrency;

  @Getter(lombok.AccessLevel.NONE)
  private final DocumentSnapshotCodec codec;

  @Getter(lombok.AccessLevel.NONE)
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private RichDocument document;

  public EditorSession(
      String sessionId,
      HistoryManager history,
      ConcurrencyController<EditorResponse> concurrency,
      DocumentSnapshotCodec codec,
      RichDocument initialDocument) {
    this.sessionId = sessionId;
    this.history = history;
    this.concurrency = concurrency;
    this.codec = codec;
    replaceDocument(initialDocument);
  }

  /** Installs a freshly loaded document and binds every run to a new address. */
  public void replaceDocument(RichDocument loaded) {
    this.document = loaded;
    resolver.rebindAll(loaded);
  }

  public HistorySnapshot snapshot() {
    return codec.capture(document, resolver);
  }

  public void restore(HistorySnapshot snapshot) {
    this.document = codec.restore(snapshot, resolver);
  }

  public <T> T write(Supplier<T> action) {
    lock.writeLock().lock();
    try {
      return action.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public <T> T read(Supplier<T> action) {
    lock.readLock().lock();
    try {
      return action.get();
    } finally {
      lock.readLock().unlock();
    }
  }
}
