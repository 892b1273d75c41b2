package com.flamingo.richtext.domain.enums;

/** Kind of a recorded document change, used to decide undo-step coalescing. */
public enum ChangeKind {
  /** Text insertion; consecutive insertions inside the coalescing window share one undo step. */
  INSERT,

  DELETE,

  STYLE,

  /** Paragraph split. */
  BREAK,

  /** Whole-document replacement. */
  LOAD
}
