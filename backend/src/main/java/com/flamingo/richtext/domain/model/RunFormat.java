package com.flamingo.richtext.domain.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Character formatting of a {@link Run}. A {@code null} attribute means the document default
 * applies.
 */
@Getter
@Setter
public class RunFormat {

  private String fontName;
  private Double fontSize;
  private Boolean bold;
  private Boolean italic;

  /** Lower-case {@code #rrggbb}. */
  private String color;

  public RunFormat copy() {
    RunFormat copy = new RunFormat();
    copy.fontName = fontName;
    copy.fontSize = fontSize;
    copy.bold = bold;
    copy.italic = italic;
    copy.color = color;
    return copy;
  }
}
