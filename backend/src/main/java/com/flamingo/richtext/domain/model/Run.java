package com.flamingo.richtext.domain.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Atomic span of text with uniform character formatting. Runs compare by identity; two runs with
 * the same text and format are still distinct addressable spans.
 */
@Getter
public class Run {

  @Setter private String text;
  private final RunFormat format;
  private Paragraph paragraph;

  public Run(String text) {
    this(text, new RunFormat());
  }

  public Run(String text, RunFormat format) {
    this.text = text == null ? "" : text;
    this.format = format;
  }

  /** Creates a detached run with the given text and a copy of this run's format. */
  public Run withText(String newText) {
    return new Run(newText, format.copy());
  }

  public int length() {
    return text.length();
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  void attachTo(Paragraph owner) {
    this.paragraph = owner;
  }
}
