package com.flamingo.richtext.service.editor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.richtext.api.dto.request.DeleteRangeRequest;
import com.flamingo.richtext.api.dto.request.DeleteStepRequest;
import com.flamingo.richtext.api.dto.request.HistoryRequest;
import com.flamingo.richtext.api.dto.request.InsertBreakRequest;
import com.flamingo.richtext.api.dto.request.InsertTextRequest;
import com.flamingo.richtext.api.dto.request.StyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateDocumentStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateNodeStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateRangeStyleRequest;
import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.config.EditorConfig;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Selection;
import com.flamingo.richtext.exception.AddressNotFoundException;
import com.flamingo.richtext.exception.DocumentConflictException;
import com.flamingo.richtext.exception.InvalidDocumentFormatException;
import com.flamingo.richtext.service.concurrency.VersionCheck;
import com.flamingo.richtext.service.concurrency.VersionedRequest;
import com.flamingo.richtext.service.editing.SpanEditor;
import com.flamingo.richtext.service.engine.HtmlRenderer;
import com.flamingo.richtext.service.engine.PoiDocumentEngine;
import com.flamingo.richtext.service.history.DocumentSnapshotCodec;
import com.flamingo.richtext.service.render.PatchExtractor;
import com.flamingo.richtext.support.TestDocuments;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentEditorServiceImplTest {

  private static final String SESSION = "session-1";

  @Mock private MeterRegistry meterRegistry;

  @Mock private Counter counter;

  private EditorConfig editorConfig;
  private EditorSessionRegistry sessionRegistry;
  private PoiDocumentEngine documentEngine;
  private DocumentEditorServiceImpl editorService;
  private final AtomicInteger opIds = new AtomicInteger();

  @BeforeEach
  void setUp() {
    editorConfig = new EditorConfig();
    editorConfig.getDefaultDocument().setParagraphs(List.of("ABCDE", "Hello", "World"));
    documentEngine = new PoiDocumentEngine(new HtmlRenderer());
    // fixed time: consecutive inserts always fall inside the coalescing window
    Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    sessionRegistry =
        new EditorSessionRegistry(editorConfig, documentEngine, new DocumentSnapshotCodec(), clock);
    editorService =
        new DocumentEditorServiceImpl(
            sessionRegistry,
            new SpanEditor(),
            new PatchExtractor(documentEngine),
            documentEngine,
            editorConfig,
            meterRegistry);
    when(meterRegistry.counter(any(String.class), any(String.class), any(String.class)))
        .thenReturn(counter);
  }

  private EditorSession session() {
    return sessionRegistry.getOrCreate(SESSION);
  }

  private String address(int paragraph, int run) {
    EditorSession session = session();
    return TestDocuments.address(session.getResolver(), session.getDocument(), paragraph, run);
  }

  private String nextOpId() {
    return "op-" + opIds.incrementAndGet();
  }

  private UpdateNodeStyleRequest redNode(EditorResponse state, String nodeId, int from, int to) {
    return UpdateNodeStyleRequest.builder()
        .docId(state.getDocId())
        .baseVersion(state.getVersion())
        .clientOpId(nextOpId())
        .nodeId(nodeId)
        .startOffset(from)
        .endOffset(to)
        .style(StyleRequest.builder().color("#FF0000").build())
        .build();
  }

  private InsertTextRequest insert(EditorResponse state, String nodeId, int offset, String text) {
    return InsertTextRequest.builder()
        .docId(state.getDocId())
        .baseVersion(state.getVersion())
        .clientOpId(nextOpId())
        .nodeId(nodeId)
        .offset(offset)
        .text(text)
        .build();
  }

  private HistoryRequest history(EditorResponse state) {
    return HistoryRequest.builder()
        .docId(state.getDocId())
        .baseVersion(state.getVersion())
        .clientOpId(nextOpId())
        .build();
  }

  private static byte[] docx(String text) throws IOException {
    try (XWPFDocument document = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      document.createParagraph().createRun().setText(text);
      document.write(out);
      return out.toByteArray();
    }
  }

  @Test
  void shouldStartFreshDocument_whenInitialised() {
    EditorResponse response = editorService.init(SESSION, 1);

    assertThat(response.getDocId()).isNotBlank();
    assertThat(response.getVersion()).isZero();
    assertThat(response.getHistory().canUndo()).isFalse();
    assertThat(response.getPageIndex()).isEqualTo(1);
    assertThat(response.getPageCount()).isEqualTo(1);
    assertThat(response.getHtml()).contains("ABCDE", "Hello", "World");
    assertThat(response.getPatches()).isNull();
    assertThat(response.getError()).isNull();
  }

  @Test
  void shouldAssignNewIdentity_whenInitialisedAgain() {
    EditorResponse first = editorService.init(SESSION, 1);

    EditorResponse second = editorService.init(SESSION, 1);

    assertThat(second.getDocId()).isNotEqualTo(first.getDocId());
  }

  @Test
  void shouldClampRequestedPage() {
    editorService.init(SESSION, 1);

    EditorResponse response = editorService.render(SESSION, 99);

    assertThat(response.getPageIndex()).isEqualTo(1);
  }

  @Test
  void shouldColourWholeRunRed_andRenderItUnderItsAddress() {
    EditorResponse state = editorService.init(SESSION, 1);
    String node = address(0, 0);

    EditorResponse response = editorService.updateNodeStyle(SESSION, redNode(state, node, 0, 5), 1);

    String expected = "<a name=\"" + node + "\"><span style=\"color:#ff0000\">ABCDE</span></a>";
    assertThat(response.getVersion()).isEqualTo(1);
    assertThat(response.getPatches()).singleElement()
        .satisfies(patch -> assertThat(patch.html()).contains(expected));
    assertThat(response.getSelection()).isEqualTo(new Selection(node, 0, node, 5));

    EditorResponse rendered = editorService.render(SESSION, 1);
    assertThat(rendered.getHtml()).contains(expected);
    assertThat(rendered.getDocId()).isEqualTo(state.getDocId());
    assertThat(rendered.getVersion()).isEqualTo(1);
    verify(meterRegistry).counter("editor.mutation", "op", "update_node");
  }

  @Test
  void shouldStyleFreshlyInsertedText_andReportSameIdentityOnRender() {
    EditorResponse state = editorService.init(SESSION, 1);
    String node = address(0, 0);
    state = editorService.insertText(SESSION, insert(state, node, 0, "ABCDE"), 1);
    String inserted = state.getSelection().startNodeId();

    EditorResponse styled =
        editorService.updateRangeStyle(
            SESSION,
            UpdateRangeStyleRequest.builder()
                .docId(state.getDocId())
                .baseVersion(state.getVersion())
                .clientOpId(nextOpId())
                .startNodeId(inserted)
                .startOffset(0)
                .endNodeId(inserted)
                .endOffset(5)
                .style(StyleRequest.builder().color("#ff0000").build())
                .build(),
            1);

    EditorResponse rendered = editorService.render(SESSION, 1);
    assertThat(rendered.getHtml())
        .contains("<a name=\"" + inserted + "\"><span style=\"color:#ff0000\">ABCDE</span></a>");
    assertThat(rendered.getDocId()).isEqualTo(styled.getDocId());
    assertThat(rendered.getVersion()).isEqualTo(styled.getVersion()).isEqualTo(2);
  }

  @Nested
  @DisplayName("optimistic concurrency")
  class Concurrency {

    @Test
    void shouldReplayCachedResponse_whenOperationRepeated() {
      EditorResponse state = editorService.init(SESSION, 1);
      UpdateNodeStyleRequest request = redNode(state, address(0, 0), 1, 3);

      EditorResponse first = editorService.updateNodeStyle(SESSION, request, 1);
      EditorResponse replay = editorService.updateNodeStyle(SESSION, request, 1);

      assertThat(replay).isSameAs(first);
      assertThat(editorService.render(SESSION, 1).getVersion()).isEqualTo(1);
      assertThat(session().getDocument().getParagraphs().get(0).getRuns()).hasSize(3);
      verify(meterRegistry).counter("editor.replay", "op", "update_node");
    }

    @Test
    void shouldRejectStaleVersion_withCurrentState() {
      EditorResponse state = editorService.init(SESSION, 1);
      editorService.updateNodeStyle(SESSION, redNode(state, address(1, 0), 0, 5), 1);

      Throwable thrown =
          catchThrowable(
              () -> editorService.updateNodeStyle(SESSION, redNode(state, address(0, 0), 0, 2), 1));

      assertThat(thrown).isInstanceOf(DocumentConflictException.class);
      DocumentConflictException conflict = (DocumentConflictException) thrown;
      assertThat(conflict.getCheck()).isEqualTo(VersionCheck.VERSION_CONFLICT);
      EditorResponse current = conflict.getCurrentState();
      assertThat(current.getError()).isEqualTo("version_conflict");
      assertThat(current.getDocId()).isEqualTo(state.getDocId());
      assertThat(current.getVersion()).isEqualTo(1);
      assertThat(current.getHtml()).contains("ABCDE");
      assertThat(session().getDocument().getParagraphs().get(0).getRuns()).hasSize(1);
      verify(meterRegistry).counter("editor.conflict", "type", "version_conflict");
    }

    @Test
    void shouldRejectForeignDocument() {
      editorService.init(SESSION, 1);
      UpdateNodeStyleRequest request =
          UpdateNodeStyleRequest.builder()
              .docId("someone-elses-doc")
              .baseVersion(0L)
              .clientOpId(nextOpId())
              .nodeId(address(0, 0))
              .startOffset(0)
              .endOffset(1)
              .build();

      assertThatThrownBy(() -> editorService.updateNodeStyle(SESSION, request, 1))
          .isInstanceOfSatisfying(
              DocumentConflictException.class,
              e -> assertThat(e.getCurrentState().getError()).isEqualTo("doc_conflict"));
    }

    @Test
    void shouldLetFirstWriterWin_whenTwoClientsShareBaseVersion() {
      EditorResponse state = editorService.init(SESSION, 1);

      EditorResponse winner =
          editorService.insertText(SESSION, insert(state, address(1, 0), 5, "!"), 1);

      assertThat(winner.getVersion()).isEqualTo(1);
      assertThatThrownBy(
              () -> editorService.insertText(SESSION, insert(state, address(2, 0), 0, "?"), 1))
          .isInstanceOf(DocumentConflictException.class);
      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nHello!\nWorld");
    }

    @Test
    void shouldAdvanceVersionByOne_perAcceptedMutation() {
      EditorResponse state = editorService.init(SESSION, 1);
      for (int i = 1; i <= 3; i++) {
        state = editorService.insertText(SESSION, insert(state, address(1, 0), 0, "x"), 1);
        assertThat(state.getVersion()).isEqualTo(i);
      }
    }
  }

  @Nested
  @DisplayName("history")
  class History {

    @Test
    void shouldRestoreAndReapply_throughUndoAndRedo() {
      EditorResponse state = editorService.init(SESSION, 1);
      String hello = address(1, 0);
      state = editorService.updateNodeStyle(SESSION, redNode(state, hello, 0, 5), 1);

      EditorResponse undone = editorService.undo(SESSION, history(state), 1);

      assertThat(undone.getDidUndo()).isTrue();
      assertThat(undone.getVersion()).isEqualTo(2);
      assertThat(undone.getHistory().canRedo()).isTrue();
      assertThat(session().getResolver().resolve(hello).orElseThrow().getFormat().getColor())
          .isNull();

      EditorResponse redone = editorService.redo(SESSION, history(undone), 1);

      assertThat(redone.getDidRedo()).isTrue();
      assertThat(redone.getVersion()).isEqualTo(3);
      assertThat(session().getResolver().resolve(hello).orElseThrow().getFormat().getColor())
          .isEqualTo("#ff0000");
    }

    @Test
    void shouldReturnToInitialPage_afterUndoingMixedEdits_andToFinalPageAfterRedo() {
      EditorResponse state = editorService.init(SESSION, 1);
      String initialHtml = editorService.render(SESSION, 1).getHtml();
      String abcde = address(0, 0);
      String hello = address(1, 0);
      String world = address(2, 0);

      state =
          editorService.insertBreak(
              SESSION,
              InsertBreakRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(state.getVersion())
                  .clientOpId(nextOpId())
                  .nodeId(hello)
                  .offset(2)
                  .build(),
              1);
      state = editorService.insertText(SESSION, insert(state, world, 5, "!"), 1);
      state =
          editorService.deleteBackward(
              SESSION,
              DeleteStepRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(state.getVersion())
                  .clientOpId(nextOpId())
                  .nodeId(hello)
                  .offset(0)
                  .build(),
              1);
      state =
          editorService.updateRangeStyle(
              SESSION,
              UpdateRangeStyleRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(state.getVersion())
                  .clientOpId(nextOpId())
                  .startNodeId(abcde)
                  .startOffset(1)
                  .endNodeId(world)
                  .endOffset(1)
                  .style(StyleRequest.builder().italic(true).build())
                  .build(),
              1);
      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nHello\nWorld!");
      assertThat(state.getHistory().undoDepth()).isEqualTo(4);
      String finalHtml = editorService.render(SESSION, 1).getHtml();

      for (int i = 0; i < 4; i++) {
        state = editorService.undo(SESSION, history(state), 1);
        assertThat(state.getDidUndo()).isTrue();
      }
      assertThat(editorService.render(SESSION, 1).getHtml()).isEqualTo(initialHtml);
      assertThat(state.getHistory().canUndo()).isFalse();

      for (int i = 0; i < 4; i++) {
        state = editorService.redo(SESSION, history(state), 1);
        assertThat(state.getDidRedo()).isTrue();
      }
      assertThat(editorService.render(SESSION, 1).getHtml()).isEqualTo(finalHtml);
      assertThat(state.getVersion()).isEqualTo(12);
    }

    @Test
    void shouldReportNothingDone_whenUndoStackEmpty() {
      EditorResponse state = editorService.init(SESSION, 1);

      EditorResponse response = editorService.undo(SESSION, history(state), 1);

      assertThat(response.getDidUndo()).isFalse();
      assertThat(response.getVersion()).isZero();
      assertThat(response.getHtml()).isNotNull();
    }

    @Test
    void shouldUndoConsecutiveInsertsAsOneStep() {
      EditorResponse state = editorService.init(SESSION, 1);
      String world = address(2, 0);
      state = editorService.insertText(SESSION, insert(state, world, 5, "!"), 1);
      state = editorService.insertText(SESSION, insert(state, world, 1, "?"), 1);
      assertThat(state.getHistory().undoDepth()).isEqualTo(1);

      editorService.undo(SESSION, history(state), 1);

      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nHello\nWorld");
    }

    @Test
    void shouldKeepPreUploadContentUndoable() throws IOException {
      editorService.init(SESSION, 1);

      EditorResponse uploaded = editorService.loadDocument(SESSION, null, docx("Uploaded"));

      assertThat(uploaded.getVersion()).isZero();
      assertThat(uploaded.getHistory().canUndo()).isTrue();
      assertThat(uploaded.getHtml()).contains("Uploaded");

      EditorResponse undone = editorService.undo(SESSION, history(uploaded), 1);

      assertThat(undone.getDocId()).isEqualTo(uploaded.getDocId());
      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nHello\nWorld");
    }
  }

  @Nested
  @DisplayName("upload")
  class Upload {

    @Test
    void shouldAssignNewIdentity_andAnswerFirstPage() throws IOException {
      EditorResponse state = editorService.init(SESSION, 1);

      EditorResponse uploaded = editorService.loadDocument(SESSION, null, docx("Fresh"));

      assertThat(uploaded.getDocId()).isNotEqualTo(state.getDocId());
      assertThat(uploaded.getPageIndex()).isEqualTo(1);
      assertThat(session().getDocument().text()).isEqualTo("Fresh");
      assertThat(session().getResolver().size()).isEqualTo(1);
    }

    @Test
    void shouldLeaveDocumentUntouched_whenUploadInvalid() {
      EditorResponse state = editorService.init(SESSION, 1);

      assertThatThrownBy(() -> editorService.loadDocument(SESSION, null, new byte[] {1, 2, 3}))
          .isInstanceOf(InvalidDocumentFormatException.class);

      EditorResponse after = editorService.render(SESSION, 1);
      assertThat(after.getDocId()).isEqualTo(state.getDocId());
      assertThat(after.getHistory().canUndo()).isFalse();
    }

    @Test
    void shouldReplayVersionedUpload() throws IOException {
      EditorResponse state = editorService.init(SESSION, 1);
      VersionedRequest versioned = new VersionedRequest(state.getDocId(), 0, "upload-1");

      EditorResponse first = editorService.loadDocument(SESSION, versioned, docx("Once"));
      EditorResponse again = editorService.loadDocument(SESSION, versioned, docx("Twice"));

      assertThat(again).isSameAs(first);
      assertThat(session().getDocument().text()).isEqualTo("Once");
    }

    @Test
    void shouldRejectVersionedUpload_whenStale() {
      editorService.init(SESSION, 1);
      VersionedRequest stale = new VersionedRequest("old-doc", 0, "upload-1");

      assertThatThrownBy(() -> editorService.loadDocument(SESSION, stale, docx("Late")))
          .isInstanceOf(DocumentConflictException.class);
      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nHello\nWorld");
    }
  }

  @Nested
  @DisplayName("unresolved addresses")
  class Addressing {

    @Test
    void shouldTreatUnknownAddressAsNoOp_butAdvanceVersion() {
      EditorResponse state = editorService.init(SESSION, 1);

      EditorResponse response =
          editorService.updateNodeStyle(SESSION, redNode(state, "Run_missing", 0, 2), 1);

      assertThat(response.getVersion()).isEqualTo(1);
      assertThat(response.getHistory().canUndo()).isTrue();
      assertThat(response.getHtml()).doesNotContain("color:#ff0000");
      assertThat(response.getPatches()).isNull();
    }

    @Test
    void shouldReportMissingAddress_inStrictMode() {
      editorConfig.getAddressing().setStrict(true);
      EditorResponse state = editorService.init(SESSION, 1);

      assertThatThrownBy(
              () -> editorService.updateNodeStyle(SESSION, redNode(state, "Run_missing", 0, 2), 1))
          .isInstanceOfSatisfying(
              AddressNotFoundException.class,
              e -> assertThat(e.getAddresses()).containsExactly("Run_missing"));

      EditorResponse after = editorService.render(SESSION, 1);
      assertThat(after.getVersion()).isZero();
      assertThat(after.getHistory().canUndo()).isFalse();
    }
  }

  @Nested
  @DisplayName("response shape")
  class ResponseShape {

    @Test
    void shouldRenderFullPage_whenParagraphCountChanges() {
      EditorResponse state = editorService.init(SESSION, 1);
      String hello = address(1, 0);

      EditorResponse response =
          editorService.insertBreak(
              SESSION,
              InsertBreakRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(0L)
                  .clientOpId(nextOpId())
                  .nodeId(hello)
                  .offset(2)
                  .build(),
              1);

      assertThat(response.getPatches()).isNull();
      assertThat(response.getHtml()).isNotNull();
      assertThat(response.getSelection()).isEqualTo(new Selection(hello, 0, hello, 0));
      assertThat(session().getDocument().paragraphCount()).isEqualTo(4);
    }

    @Test
    void shouldMergeParagraphs_whenBackspacingAtParagraphStart() {
      EditorResponse state = editorService.init(SESSION, 1);
      String hello = address(1, 0);

      EditorResponse response =
          editorService.deleteBackward(
              SESSION,
              DeleteStepRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(0L)
                  .clientOpId(nextOpId())
                  .nodeId(address(2, 0))
                  .offset(0)
                  .build(),
              1);

      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nHelloWorld");
      assertThat(response.getHtml()).isNotNull();
      assertThat(response.getSelection()).isEqualTo(new Selection(hello, 5, hello, 5));
    }

    @Test
    void shouldPatchSingleParagraph_whenDeletingForwardInsideRun() {
      EditorResponse state = editorService.init(SESSION, 1);
      String hello = address(1, 0);

      EditorResponse response =
          editorService.deleteForward(
              SESSION,
              DeleteStepRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(0L)
                  .clientOpId(nextOpId())
                  .nodeId(hello)
                  .offset(0)
                  .count(2)
                  .build(),
              1);

      assertThat(response.getHtml()).isNull();
      assertThat(response.getPatches()).singleElement()
          .satisfies(patch -> assertThat(patch.paragraphIndex()).isEqualTo(1));
      assertThat(session().getDocument().text()).isEqualTo("ABCDE\nllo\nWorld");
    }

    @Test
    void shouldRenderFullPage_whenDeletedRangeSpansParagraphs() {
      EditorResponse state = editorService.init(SESSION, 1);

      EditorResponse response =
          editorService.deleteRange(
              SESSION,
              DeleteRangeRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(0L)
                  .clientOpId(nextOpId())
                  .startNodeId(address(0, 0))
                  .startOffset(3)
                  .endNodeId(address(2, 0))
                  .endOffset(2)
                  .build(),
              1);

      assertThat(response.getPatches()).isNull();
      assertThat(session().getDocument().text()).isEqualTo("ABC\n\nrld");
    }

    @Test
    void shouldRenderFullPage_whenEditedParagraphIsOffPage() {
      editorConfig.getRender().setParagraphsPerPage(1);
      EditorResponse state = editorService.init(SESSION, 1);
      assertThat(state.getPageCount()).isEqualTo(3);

      EditorResponse response =
          editorService.updateNodeStyle(SESSION, redNode(state, address(1, 0), 0, 2), 1);

      assertThat(response.getPatches()).isNull();
      assertThat(response.getHtml()).contains("ABCDE").doesNotContain("Hello");
    }

    @Test
    void shouldRenderFullPage_whenRangeStyleSpansParagraphs() {
      EditorResponse state = editorService.init(SESSION, 1);
      String hello = address(1, 0);
      String world = address(2, 0);

      EditorResponse response =
          editorService.updateRangeStyle(
              SESSION,
              UpdateRangeStyleRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(0L)
                  .clientOpId(nextOpId())
                  .startNodeId(hello)
                  .startOffset(2)
                  .endNodeId(world)
                  .endOffset(3)
                  .style(StyleRequest.builder().bold(true).build())
                  .build(),
              1);

      assertThat(response.getPatches()).isNull();
      assertThat(response.getSelection()).isEqualTo(new Selection(hello, 0, world, 3));
      assertThat(response.getHtml()).contains("font-weight:bold");
    }

    @Test
    void shouldRestyleEveryRun_whenUpdatingWholeDocument() {
      EditorResponse state = editorService.init(SESSION, 1);

      EditorResponse response =
          editorService.updateDocumentStyle(
              SESSION,
              UpdateDocumentStyleRequest.builder()
                  .docId(state.getDocId())
                  .baseVersion(0L)
                  .clientOpId(nextOpId())
                  .fontName("Georgia")
                  .fontSize(16.0)
                  .build(),
              1);

      assertThat(response.getHtml()).contains("font-family:'Georgia';font-size:16pt");
      assertThat(session().getDocument().runs())
          .allSatisfy(run -> assertThat(run.getFormat().getFontName()).isEqualTo("Georgia"));
    }
  }

  @Test
  void shouldExportLoadableDocx() {
    editorService.init(SESSION, 1);

    ExportedDocument exported = editorService.exportDocument(SESSION);

    assertThat(exported.fileName()).isEqualTo("modified_document.docx");
    assertThat(exported.contentType()).contains("wordprocessingml");
    RichDocument reloaded = documentEngine.load(exported.content());
    assertThat(reloaded.text()).isEqualTo("ABCDE\nHello\nWorld");
  }

  @Test
  void shouldIsolateSessions() {
    EditorResponse state = editorService.init(SESSION, 1);
    editorService.insertText(SESSION, insert(state, address(0, 0), 0, ">"), 1);

    EditorResponse other = editorService.init("session-2", 1);

    assertThat(other.getDocId()).isNotEqualTo(state.getDocId());
    assertThat(other.getVersion()).isZero();
    assertThat(sessionRegistry.getOrCreate("session-2").getDocument().text())
        .isEqualTo("ABCDE\nHello\nWorld");
    assertThat(session().getDocument().text()).startsWith(">ABCDE");
    assertThat(editorService.closeSession("session-2")).isTrue();
    assertThat(editorService.closeSession("session-2")).isFalse();
  }
}
