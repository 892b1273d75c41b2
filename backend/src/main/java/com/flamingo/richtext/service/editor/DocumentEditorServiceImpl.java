package com.flamingo.richtext.service.editor;

import com.flamingo.richtext.api.dto.request.DeleteRangeRequest;
import com.flamingo.richtext.api.dto.request.DeleteStepRequest;
import com.flamingo.richtext.api.dto.request.HistoryRequest;
import com.flamingo.richtext.api.dto.request.InsertBreakRequest;
import com.flamingo.richtext.api.dto.request.InsertTextRequest;
import com.flamingo.richtext.api.dto.request.UpdateDocumentStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateNodeStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateRangeStyleRequest;
import com.flamingo.richtext.api.dto.request.VersionedEditRequest;
import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.api.dto.response.HistoryInfo;
import com.flamingo.richtext.config.EditorConfig;
import com.flamingo.richtext.domain.enums.ChangeKind;
import com.flamingo.richtext.domain.model.Caret;
import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Run;
import com.flamingo.richtext.domain.model.Selection;
import com.flamingo.richtext.exception.AddressNotFoundException;
import com.flamingo.richtext.exception.DocumentConflictException;
import com.flamingo.richtext.service.addressing.AddressResolver;
import com.flamingo.richtext.service.concurrency.ConcurrencyController;
import com.flamingo.richtext.service.concurrency.OpCacheKey;
import com.flamingo.richtext.service.concurrency.VersionCheck;
import com.flamingo.richtext.service.concurrency.VersionedRequest;
import com.flamingo.richtext.service.editing.SpanEditor;
import com.flamingo.richtext.service.engine.DocumentEngine;
import com.flamingo.richtext.service.history.HistorySnapshot;
import com.flamingo.richtext.service.render.PageLayout;
import com.flamingo.richtext.service.render.ParagraphPatch;
import com.flamingo.richtext.service.render.PatchExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentEditorService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentEditorServiceImpl implements DocumentEditorService {

  private static final int UPLOAD_PAGE = 1;

  private final EditorSessionRegistry sessionRegistry;
  private final SpanEditor spanEditor;
  private final PatchExtractor patchExtractor;
  private final DocumentEngine documentEngine;
  private final EditorConfig editorConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "editor.init", description = "Time to reset a session to the default document")
  public EditorResponse init(String sessionId, int page) {
    EditorSession session = sessionRegistry.getOrCreate(sessionId);
    return session.write(
        () -> {
          session.replaceDocument(sessionRegistry.defaultDocument());
          session.getHistory().clear();
          String docId = session.getConcurrency().resetIdentity();
          meterRegistry.counter("editor.document.loaded", "source", "default").increment();
          log.info("Session {} initialised with default document {}", sessionId, docId);
          return fullRender(session, page);
        });
  }

  @Override
  @Timed(value = "editor.render", description = "Time to render a page")
  public EditorResponse render(String sessionId, int page) {
    EditorSession session = sessionRegistry.getOrCreate(sessionId);
    return session.read(() -> fullRender(session, page));
  }

  @Override
  @Timed(value = "editor.update", description = "Time to restyle the whole document")
  public EditorResponse updateDocumentStyle(
      String sessionId, UpdateDocumentStyleRequest request, int page) {
    return mutate(
        sessionId,
        "update",
        request,
        page,
        ChangeKind.STYLE,
        List.of(),
        session -> {
          spanEditor.updateDocumentStyle(session.getDocument(), request.toStyleUpdate());
          return EditOutcome.fullPage(null);
        });
  }

  @Override
  @Timed(value = "editor.update_node", description = "Time to restyle part of a run")
  public EditorResponse updateNodeStyle(
      String sessionId, UpdateNodeStyleRequest request, int page) {
    return mutate(
        sessionId,
        "update_node",
        request,
        page,
        ChangeKind.STYLE,
        List.of(request.getNodeId()),
        session ->
            EditOutcome.patchable(
                spanEditor
                    .updateRangeStyle(
                        session.getDocument(),
                        session.getResolver(),
                        request.getNodeId(),
                        request.getStartOffset(),
                        request.getNodeId(),
                        request.getEndOffset(),
                        request.toStyleUpdate())
                    .orElse(null)));
  }

  @Override
  @Timed(value = "editor.update_range", description = "Time to restyle a span")
  public EditorResponse updateRangeStyle(
      String sessionId, UpdateRangeStyleRequest request, int page) {
    return mutate(
        sessionId,
        "update_range",
        request,
        page,
        ChangeKind.STYLE,
        List.of(request.getStartNodeId(), request.getEndNodeId()),
        session ->
            EditOutcome.patchable(
                spanEditor
                    .updateRangeStyle(
                        session.getDocument(),
                        session.getResolver(),
                        request.getStartNodeId(),
                        request.getStartOffset(),
                        request.getEndNodeId(),
                        request.getEndOffset(),
                        request.toStyleUpdate())
                    .orElse(null)));
  }

  @Override
  @Timed(value = "editor.insert_text", description = "Time to insert text")
  public EditorResponse insertText(String sessionId, InsertTextRequest request, int page) {
    return mutate(
        sessionId,
        "insert_text",
        request,
        page,
        ChangeKind.INSERT,
        List.of(request.getNodeId()),
        session -> {
          Caret caret =
              spanEditor.insertText(
                  session.getResolver(),
                  request.getNodeId(),
                  request.getOffset(),
                  request.getText(),
                  request.toStyleUpdate());
          return EditOutcome.patchable(Selection.collapsed(caret));
        });
  }

  @Override
  @Timed(value = "editor.delete_range", description = "Time to delete a span")
  public EditorResponse deleteRange(String sessionId, DeleteRangeRequest request, int page) {
    return mutate(
        sessionId,
        "delete_range",
        request,
        page,
        ChangeKind.DELETE,
        List.of(request.getStartNodeId(), request.getEndNodeId()),
        session -> {
          boolean singleParagraph =
              sameParagraph(
                  session.getResolver(), request.getStartNodeId(), request.getEndNodeId());
          Caret caret =
              spanEditor.deleteRange(
                  session.getDocument(),
                  session.getResolver(),
                  request.getStartNodeId(),
                  request.getStartOffset(),
                  request.getEndNodeId(),
                  request.getEndOffset());
          Selection selection = Selection.collapsed(caret);
          return singleParagraph
              ? EditOutcome.patchable(selection)
              : EditOutcome.fullPage(selection);
        });
  }

  @Override
  @Timed(value = "editor.delete_backward", description = "Time to delete before the caret")
  public EditorResponse deleteBackward(String sessionId, DeleteStepRequest request, int page) {
    return mutate(
        sessionId,
        "delete_backward",
        request,
        page,
        ChangeKind.DELETE,
        List.of(request.getNodeId()),
        session ->
            EditOutcome.patchable(
                Selection.collapsed(
                    spanEditor.deleteBackward(
                        session.getDocument(),
                        session.getResolver(),
                        request.getNodeId(),
                        request.getOffset(),
                        stepCount(request)))));
  }

  @Override
  @Timed(value = "editor.delete_forward", description = "Time to delete after the caret")
  public EditorResponse deleteForward(String sessionId, DeleteStepRequest request, int page) {
    return mutate(
        sessionId,
        "delete_forward",
        request,
        page,
        ChangeKind.DELETE,
        List.of(request.getNodeId()),
        session ->
            EditOutcome.patchable(
                Selection.collapsed(
                    spanEditor.deleteForward(
                        session.getDocument(),
                        session.getResolver(),
                        request.getNodeId(),
                        request.getOffset(),
                        stepCount(request)))));
  }

  @Override
  @Timed(value = "editor.insert_break", description = "Time to split a paragraph")
  public EditorResponse insertBreak(String sessionId, InsertBreakRequest request, int page) {
    return mutate(
        sessionId,
        "insert_break",
        request,
        page,
        ChangeKind.BREAK,
        List.of(request.getNodeId()),
        session ->
            EditOutcome.fullPage(
                Selection.collapsed(
                    spanEditor.insertBreak(
                        session.getDocument(),
                        session.getResolver(),
                        request.getNodeId(),
                        request.getOffset()))));
  }

  @Override
  @Timed(value = "editor.undo", description = "Time to undo")
  public EditorResponse undo(String sessionId, HistoryRequest request, int page) {
    return mutate(
        sessionId,
        "undo",
        request,
        page,
        null,
        List.of(),
        session -> {
          Optional<HistorySnapshot> target = session.getHistory().undo(session::snapshot);
          target.ifPresent(session::restore);
          if (target.isPresent()) {
            log.info("Session {} undo applied", sessionId);
          }
          return EditOutcome.undo(target.isPresent());
        });
  }

  @Override
  @Timed(value = "editor.redo", description = "Time to redo")
  public EditorResponse redo(String sessionId, HistoryRequest request, int page) {
    return mutate(
        sessionId,
        "redo",
        request,
        page,
        null,
        List.of(),
        session -> {
          Optional<HistorySnapshot> target = session.getHistory().redo(session::snapshot);
          target.ifPresent(session::restore);
          if (target.isPresent()) {
            log.info("Session {} redo applied", sessionId);
          }
          return EditOutcome.redo(target.isPresent());
        });
  }

  @Override
  @Timed(value = "editor.upload", description = "Time to load an uploaded document")
  public EditorResponse loadDocument(
      String sessionId, VersionedRequest versioned, byte[] content) {
    EditorSession session = sessionRegistry.getOrCreate(sessionId);
    return session.write(
        () -> {
          OpCacheKey key = versioned == null ? null : OpCacheKey.of(versioned, UPLOAD_PAGE);
          if (key != null) {
            Optional<EditorResponse> replay = replayOrValidate(session, "upload", key, UPLOAD_PAGE);
            if (replay.isPresent()) {
              return replay.get();
            }
          }

          RichDocument loaded = documentEngine.load(content);
          HistorySnapshot previous = session.snapshot();
          session.replaceDocument(loaded);
          session.getHistory().resetTo(previous);
          String docId = session.getConcurrency().resetIdentity();
          meterRegistry.counter("editor.document.loaded", "source", "upload").increment();
          log.info(
              "Session {} loaded uploaded document {} ({} paragraphs)",
              sessionId,
              docId,
              loaded.paragraphCount());

          EditorResponse response = fullRender(session, UPLOAD_PAGE);
          if (key != null) {
            session.getConcurrency().cacheResponse(key, response);
          }
          return response;
        });
  }

  @Override
  @Timed(value = "editor.download", description = "Time to export a document")
  public ExportedDocument exportDocument(String sessionId) {
    EditorSession session = sessionRegistry.getOrCreate(sessionId);
    return session.read(
        () ->
            new ExportedDocument(
                documentEngine.export(session.getDocument()),
                documentEngine.contentType(),
                documentEngine.exportFileName()));
  }

  @Override
  public boolean closeSession(String sessionId) {
    return sessionRegistry.remove(sessionId);
  }

  private EditorResponse mutate(
      String sessionId,
      String op,
      VersionedEditRequest request,
      int page,
      ChangeKind kind,
      List<String> addresses,
      Function<EditorSession, EditOutcome> edit) {
    EditorSession session = sessionRegistry.getOrCreate(sessionId);
    OpCacheKey key = OpCacheKey.of(request.toVersionedRequest(), page);
    return session.write(
        () -> {
          Optional<EditorResponse> replay = replayOrValidate(session, op, key, page);
          if (replay.isPresent()) {
            return replay.get();
          }
          requireAddresses(session.getResolver(), addresses);
          if (kind != null) {
            session.getHistory().recordChange(kind, session::snapshot);
          }

          int paragraphsBefore = session.getDocument().paragraphCount();
          EditOutcome outcome = edit.apply(session);
          if (outcome.advancesVersion()) {
            session.getConcurrency().bumpVersion();
          }

          EditorResponse response = buildResponse(session, page, outcome, paragraphsBefore);
          session.getConcurrency().cacheResponse(key, response);
          meterRegistry.counter("editor.mutation", "op", op).increment();
          log.debug(
              "Session {} applied {} -> version {}", sessionId, op, response.getVersion());
          return response;
        });
  }

  /**
   * Returns the cached response for a repeated operation, or empty if the operation is new and
   * names the current identity and version.
   *
   * @throws DocumentConflictException if the operation is new and stale
   */
  private Optional<EditorResponse> replayOrValidate(
      EditorSession session, String op, OpCacheKey key, int page) {
    ConcurrencyController<EditorResponse> concurrency = session.getConcurrency();
    Optional<EditorResponse> cached = concurrency.lookupCached(key);
    if (cached.isPresent()) {
      meterRegistry.counter("editor.replay", "op", op).increment();
      log.debug("Replaying cached response for {} op {}", op, key.clientOpId());
      return cached;
    }

    VersionCheck check = concurrency.validate(key.docId(), key.baseVersion());
    if (check != VersionCheck.OK) {
      meterRegistry.counter("editor.conflict", "type", check.errorCode()).increment();
      log.warn(
          "Rejected {} on session {}: {} (client {}@{}, server {}@{})",
          op,
          session.getSessionId(),
          check.errorCode(),
          key.docId(),
          key.baseVersion(),
          concurrency.docId(),
          concurrency.version());
      PageLayout layout = layout(session.getDocument(), page);
      throw new DocumentConflictException(
          check,
          baseResponse(session, layout)
              .error(check.errorCode())
              .html(renderPage(session, layout))
              .build());
    }
    return Optional.empty();
  }

  private void requireAddresses(AddressResolver resolver, List<String> addresses) {
    if (!editorConfig.getAddressing().isStrict()) {
      return;
    }
    List<String> missing =
        addresses.stream().filter(a -> resolver.resolve(a).isEmpty()).distinct().toList();
    if (!missing.isEmpty()) {
      log.warn("Unresolved addresses in strict mode: {}", missing);
      throw new AddressNotFoundException(missing);
    }
  }

  private EditorResponse buildResponse(
      EditorSession session, int page, EditOutcome outcome, int paragraphsBefore) {
    RichDocument document = session.getDocument();
    PageLayout layout = layout(document, page);
    EditorResponse.EditorResponseBuilder builder =
        baseResponse(session, layout)
            .selection(outcome.selection())
            .didUndo(outcome.didUndo())
            .didRedo(outcome.didRedo());

    Selection selection = outcome.selection();
    Optional<ParagraphPatch> patch =
        outcome.patchable() && selection != null && document.paragraphCount() == paragraphsBefore
            ? patchExtractor.rangePatch(
                document, session.getResolver(), selection.startNodeId(), selection.endNodeId())
            : Optional.empty();
    if (patch.isPresent() && layout.contains(patch.get().paragraphIndex())) {
      return builder.patches(List.of(patch.get())).build();
    }
    return builder.html(renderPage(session, layout)).build();
  }

  private EditorResponse fullRender(EditorSession session, int page) {
    PageLayout layout = layout(session.getDocument(), page);
    return baseResponse(session, layout).html(renderPage(session, layout)).build();
  }

  private EditorResponse.EditorResponseBuilder baseResponse(
      EditorSession session, PageLayout layout) {
    return EditorResponse.builder()
        .docId(session.getConcurrency().docId())
        .version(session.getConcurrency().version())
        .history(HistoryInfo.from(session.getHistory().state()))
        .pageIndex(layout.pageIndex())
        .pageCount(layout.pageCount());
  }

  private String renderPage(EditorSession session, PageLayout layout) {
    List<Paragraph> paragraphs =
        session.getDocument().getParagraphs().subList(layout.fromParagraph(), layout.toParagraph());
    return documentEngine.renderHtml(paragraphs, session.getResolver());
  }

  private PageLayout layout(RichDocument document, int page) {
    return PageLayout.of(
        document.paragraphCount(), editorConfig.getRender().getParagraphsPerPage(), page);
  }

  private static boolean sameParagraph(AddressResolver resolver, String first, String second) {
    Optional<Paragraph> a = resolver.resolve(first).map(Run::getParagraph);
    Optional<Paragraph> b = resolver.resolve(second).map(Run::getParagraph);
    return a.isPresent() && b.isPresent() && a.get() == b.get();
  }

  private static int stepCount(DeleteStepRequest request) {
    return request.getCount() == null ? 1 : request.getCount();
  }

  /**
   * What an edit did, as far as the response is concerned.
   *
   * @param advancesVersion whether the version moves forward
   * @param selection caret or span to report, may be null
   * @param patchable whether a single-paragraph patch around the selection may stand in for the
   *     full page
   */
  private record EditOutcome(
      boolean advancesVersion,
      Selection selection,
      boolean patchable,
      Boolean didUndo,
      Boolean didRedo) {

    static EditOutcome patchable(Selection selection) {
      return new EditOutcome(true, selection, true, null, null);
    }

    static EditOutcome fullPage(Selection selection) {
      return new EditOutcome(true, selection, false, null, null);
    }

    static EditOutcome undo(boolean applied) {
      return new EditOutcome(applied, null, false, applied, null);
    }

    static EditOutcome redo(boolean applied) {
      return new EditOutcome(applied, null, false, null, applied);
    }
  }
}
