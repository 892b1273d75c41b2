package com.flamingo.richtext.service.editor;

import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.config.EditorConfig;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.service.concurrency.ConcurrencyController;
import com.flamingo.richtext.service.engine.DocumentEngine;
import com.flamingo.richtext.service.history.DocumentSnapshotCodec;
import com.flamingo.richtext.service.history.HistoryManager;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Holds the live editor sessions, creating each on first use with the default document. */
@Component
@RequiredArgsConstructor
@Slf4j
public class EditorSessionRegistry {

  private final ConcurrentHashMap<String, EditorSession> sessions = new ConcurrentHashMap<>();

  private final EditorConfig editorConfig;
  private final DocumentEngine documentEngine;
  private final DocumentSnapshotCodec snapshotCodec;
  private final Clock clock;

  public EditorSession getOrCreate(String sessionId) {
    return sessions.computeIfAbsent(
        sessionId,
        id -> {
          log.info("Opening editor session {}", id);
          return new EditorSession(
              id,
              new HistoryManager(
                  editorConfig.getHistory().getCapacity(),
                  editorConfig.getHistory().getCoalesceWindow(),
                  clock),
              new ConcurrencyController<EditorResponse>(editorConfig.getOpCache().getCapacity()),
              snapshotCodec,
              defaultDocument());
        });
  }

  public Optional<EditorSession> find(String sessionId) {
    return Optional.ofNullable(sessions.get(sessionId));
  }

  public boolean remove(String sessionId) {
    boolean removed = sessions.remove(sessionId) != null;
    if (removed) {
      log.info("Closed editor session {}", sessionId);
    }
    return removed;
  }

  public int size() {
    return sessions.size();
  }

  public RichDocument defaultDocument() {
    return documentEngine.createDocument(editorConfig.getDefaultDocument().getParagraphs());
  }
}
