package com.flamingo.richtext.api.rest;

import com.flamingo.richtext.api.dto.request.DeleteRangeRequest;
import com.flamingo.richtext.api.dto.request.DeleteStepRequest;
import com.flamingo.richtext.api.dto.request.HistoryRequest;
import com.flamingo.richtext.api.dto.request.InsertBreakRequest;
import com.flamingo.richtext.api.dto.request.InsertTextRequest;
import com.flamingo.richtext.api.dto.request.UpdateDocumentStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateNodeStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateRangeStyleRequest;
import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.exception.InvalidDocumentFormatException;
import com.flamingo.richtext.service.concurrency.VersionedRequest;
import com.flamingo.richtext.service.editor.DocumentEditorService;
import com.flamingo.richtext.service.editor.ExportedDocument;
import jakarta.validation.Valid;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for collaborative document editing within a session. */
@RestController
@RequestMapping("/api/sessions/{sessionId}/editor")
@RequiredArgsConstructor
public class EditorController {

  private final DocumentEditorService editorService;

  /** Resets the session to the default document. */
  @GetMapping("/init")
  public ResponseEntity<EditorResponse> init(
      @PathVariable String sessionId, @RequestParam(defaultValue = "1") int page) {
    return ResponseEntity.ok(editorService.init(sessionId, page));
  }

  @GetMapping("/render")
  public ResponseEntity<EditorResponse> render(
      @PathVariable String sessionId, @RequestParam(defaultValue = "1") int page) {
    return ResponseEntity.ok(editorService.render(sessionId, page));
  }

  /** Restyles the whole document. */
  @PostMapping("/update")
  public ResponseEntity<EditorResponse> updateDocumentStyle(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody UpdateDocumentStyleRequest request) {
    return ResponseEntity.ok(editorService.updateDocumentStyle(sessionId, request, page));
  }

  @PostMapping("/update_node")
  public ResponseEntity<EditorResponse> updateNodeStyle(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody UpdateNodeStyleRequest request) {
    return ResponseEntity.ok(editorService.updateNodeStyle(sessionId, request, page));
  }

  @PostMapping("/update_range")
  public ResponseEntity<EditorResponse> updateRangeStyle(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody UpdateRangeStyleRequest request) {
    return ResponseEntity.ok(editorService.updateRangeStyle(sessionId, request, page));
  }

  @PostMapping("/insert_text")
  public ResponseEntity<EditorResponse> insertText(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody InsertTextRequest request) {
    return ResponseEntity.ok(editorService.insertText(sessionId, request, page));
  }

  @PostMapping("/delete_range")
  public ResponseEntity<EditorResponse> deleteRange(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody DeleteRangeRequest request) {
    return ResponseEntity.ok(editorService.deleteRange(sessionId, request, page));
  }

  @PostMapping("/delete_backward")
  public ResponseEntity<EditorResponse> deleteBackward(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody DeleteStepRequest request) {
    return ResponseEntity.ok(editorService.deleteBackward(sessionId, request, page));
  }

  @PostMapping("/delete_forward")
  public ResponseEntity<EditorResponse> deleteForward(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody DeleteStepRequest request) {
    return ResponseEntity.ok(editorService.deleteForward(sessionId, request, page));
  }

  @PostMapping("/insert_break")
  public ResponseEntity<EditorResponse> insertBreak(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody InsertBreakRequest request) {
    return ResponseEntity.ok(editorService.insertBreak(sessionId, request, page));
  }

  @PostMapping("/undo")
  public ResponseEntity<EditorResponse> undo(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody HistoryRequest request) {
    return ResponseEntity.ok(editorService.undo(sessionId, request, page));
  }

  @PostMapping("/redo")
  public ResponseEntity<EditorResponse> redo(
      @PathVariable String sessionId,
      @RequestParam(defaultValue = "1") int page,
      @Valid @RequestBody HistoryRequest request) {
    return ResponseEntity.ok(editorService.redo(sessionId, request, page));
  }

  /**
   * Replaces the session's document with an uploaded DOCX file. The identity triple is optional;
   * when all three parts are given the upload is checked and deduplicated like any other edit.
   */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<EditorResponse> upload(
      @PathVariable String sessionId,
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "doc_id", required = false) String docId,
      @RequestParam(value = "base_version", required = false) Long baseVersion,
      @RequestParam(value = "client_op_id", required = false) String clientOpId) {
    VersionedRequest versioned =
        docId != null && baseVersion != null && clientOpId != null
            ? new VersionedRequest(docId, baseVersion, clientOpId)
            : null;
    return ResponseEntity.ok(editorService.loadDocument(sessionId, versioned, readUpload(file)));
  }

  @GetMapping("/download")
  public ResponseEntity<byte[]> download(@PathVariable String sessionId) {
    ExportedDocument exported = editorService.exportDocument(sessionId);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(exported.contentType()))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(exported.fileName()).build().toString())
        .body(exported.content());
  }

  /** Discards the session. */
  @DeleteMapping
  public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
    return editorService.closeSession(sessionId)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  private static byte[] readUpload(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new InvalidDocumentFormatException("Failed to read uploaded file", e);
    }
  }
}
