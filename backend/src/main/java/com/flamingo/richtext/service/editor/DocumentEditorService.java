package com.flamingo.richtext.service.editor;

import com.flamingo.richtext.api.dto.request.DeleteRangeRequest;
import com.flamingo.richtext.api.dto.request.DeleteStepRequest;
import com.flamingo.richtext.api.dto.request.HistoryRequest;
import com.flamingo.richtext.api.dto.request.InsertBreakRequest;
import com.flamingo.richtext.api.dto.request.InsertTextRequest;
import com.flamingo.richtext.api.dto.request.UpdateDocumentStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateNodeStyleRequest;
import com.flamingo.richtext.api.dto.request.UpdateRangeStyleRequest;
import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.service.concurrency.VersionedRequest;

/**
 * Service interface for editing documents held in editor sessions.
 *
 * <p>Every mutating operation runs the same pipeline: replay a cached response for a repeated
 * operation, otherwise reject stale identity or version with a conflict, record history, apply the
 * edit, advance the version and cache the response. The {@code page} argument selects the view and
 * is clamped into range.
 */
public interface DocumentEditorService {

  /**
   * Replaces the session's document with the default document and clears its history.
   *
   * @param sessionId the session
   * @param page the requested page
   * @return full rendering under a fresh document identity at version 0
   */
  EditorResponse init(String sessionId, int page);

  /** Renders the requested page without changing anything. */
  EditorResponse render(String sessionId, int page);

  EditorResponse updateDocumentStyle(
      String sessionId, UpdateDocumentStyleRequest request, int page);

  EditorResponse updateNodeStyle(String sessionId, UpdateNodeStyleRequest request, int page);

  EditorResponse updateRangeStyle(String sessionId, UpdateRangeStyleRequest request, int page);

  EditorResponse insertText(String sessionId, InsertTextRequest request, int page);

  EditorResponse deleteRange(String sessionId, DeleteRangeRequest request, int page);

  EditorResponse deleteBackward(String sessionId, DeleteStepRequest request, int page);

  EditorResponse deleteForward(String sessionId, DeleteStepRequest request, int page);

  EditorResponse insertBreak(String sessionId, InsertBreakRequest request, int page);

  /**
   * Restores the state before the most recent recorded change. With nothing to undo the request
   * succeeds with {@code didUndo=false} and the version is unchanged.
   */
  EditorResponse undo(String sessionId, HistoryRequest request, int page);

  /** Re-applies the most recently undone change. */
  EditorResponse redo(String sessionId, HistoryRequest request, int page);

  /**
   * Replaces the session's document with an uploaded one. The replaced content stays reachable
   * through a single undo step.
   *
   * @param sessionId the session
   * @param versioned identity, version and operation id, or {@code null} for an unchecked upload
   * @param content the document bytes
   * @return page 1 of the new document under a fresh identity at version 0
   */
  EditorResponse loadDocument(String sessionId, VersionedRequest versioned, byte[] content);

  ExportedDocument exportDocument(String sessionId);

  /** Discards the session and all of its state. */
  boolean closeSession(String sessionId);
}
