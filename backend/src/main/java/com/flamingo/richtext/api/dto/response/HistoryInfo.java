package com.flamingo.richtext.api.dto.response;

import com.flamingo.richtext.service.history.HistoryState;

/** Undo/redo availability as reported to the client. */
public record HistoryInfo(boolean canUndo, boolean canRedo, int undoDepth, int redoDepth) {

  public static HistoryInfo from(HistoryState state) {
    return new HistoryInfo(state.canUndo(), state.canRedo(), state.undoDepth(), state.redoDepth());
  }
}
