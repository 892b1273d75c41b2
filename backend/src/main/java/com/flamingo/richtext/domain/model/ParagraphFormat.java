package com.flamingo.richtext.domain.model;

import com.flamingo.richtext.domain.enums.Alignment;
import lombok.Getter;
import lombok.Setter;

/** Block-level formatting of a {@link Paragraph}. */
@Getter
@Setter
public class ParagraphFormat {

  private Alignment alignment;

  /** First-line indent in points. */
  private Double firstLineIndent;

  public ParagraphFormat copy() {
    ParagraphFormat copy = new ParagraphFormat();
    copy.alignment = alignment;
    copy.firstLineIndent = firstLineIndent;
    return copy;
  }
}
