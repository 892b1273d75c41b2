package com.flamingo.richtext.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.richtext.domain.model.Selection;
import com.flamingo.richtext.service.render.ParagraphPatch;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Response DTO for every editor operation. Exactly one of {@code html} and {@code patches} is set.
 * A conflict reuses this shape with {@code error} filled in.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EditorResponse {

  /** {@code doc_conflict} or {@code version_conflict}; absent on success. */
  private final String error;

  private final String docId;
  private final long version;
  private final HistoryInfo history;
  private final int pageIndex;
  private final int pageCount;

  /** Full rendering of the served page. */
  private final String html;

  /** Replacement paragraphs when the edit stayed inside one paragraph on the served page. */
  private final List<ParagraphPatch> patches;

  private final Selection selection;
  private final Boolean didUndo;
  private final Boolean didRedo;
}
