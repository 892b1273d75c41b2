package com.flamingo.richtext.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered sequence of {@link Paragraph}s. Owns every paragraph and, through them, every run. */
public class RichDocument {

  private final List<Paragraph> paragraphs = new ArrayList<>();

  public List<Paragraph> getParagraphs() {
    return Collections.unmodifiableList(paragraphs);
  }

  public void appendParagraph(Paragraph paragraph) {
    insertParagraph(paragraphs.size(), paragraph);
  }

  public void insertParagraph(int index, Paragraph paragraph) {
    paragraphs.add(index, paragraph);
    paragraph.attachTo(this);
  }

  public void removeParagraph(Paragraph paragraph) {
    int index = indexOf(paragraph);
    if (index >= 0) {
      paragraphs.remove(index);
      paragraph.attachTo(null);
    }
  }

  public int indexOf(Paragraph paragraph) {
    for (int i = 0; i < paragraphs.size(); i++) {
      if (paragraphs.get(i) == paragraph) {
        return i;
      }
    }
    return -1;
  }

  public Paragraph paragraphAt(int index) {
    return index >= 0 && index < paragraphs.size() ? paragraphs.get(index) : null;
  }

  public int paragraphCount() {
    return paragraphs.size();
  }

  /** All runs in document order. */
  public List<Run> runs() {
    List<Run> runs = new ArrayList<>();
    paragraphs.forEach(paragraph -> runs.addAll(paragraph.getRuns()));
    return runs;
  }

  /** Identity-based position of the run in document order, or -1. */
  public int runIndex(Run run) {
    List<Run> runs = runs();
    for (int i = 0; i < runs.size(); i++) {
      if (runs.get(i) == run) {
        return i;
      }
    }
    return -1;
  }

  public String text() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < paragraphs.size(); i++) {
      if (i > 0) {
        text.append('\n');
      }
      text.append(paragraphs.get(i).text());
    }
    return text.toString();
  }
}
