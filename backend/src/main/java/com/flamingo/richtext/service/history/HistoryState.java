package com.flamingo.richtext.service.history;

/** Point-in-time view of the undo/redo stacks. */
public record HistoryState(boolean canUndo, boolean canRedo, int undoDepth, int redoDepth) {}
