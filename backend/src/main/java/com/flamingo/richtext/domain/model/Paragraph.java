package com.flamingo.richtext.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/** Ordered container of {@link Run}s plus block-level formatting. */
public class Paragraph {

  private final List<Run> runs = new ArrayList<>();
  @Getter private final ParagraphFormat format;
  @Getter private RichDocument document;

  public Paragraph() {
    this(new ParagraphFormat());
  }

  public Paragraph(ParagraphFormat format) {
    this.format = format;
  }

  public List<Run> getRuns() {
    return Collections.unmodifiableList(runs);
  }

  public void appendRun(Run run) {
    insertRun(runs.size(), run);
  }

  public void insertRun(int index, Run run) {
    detach(run);
    runs.add(index, run);
    run.attachTo(this);
  }

  /**
   * Replaces {@code target} with {@code replacements} at the same position.
   *
   * @throws IllegalArgumentException if the target is not a child of this paragraph
   */
  public void replaceRun(Run target, List<Run> replacements) {
    int index = indexOf(target);
    if (index < 0) {
      throw new IllegalArgumentException("Run is not part of this paragraph");
    }
    runs.remove(index);
    target.attachTo(null);
    for (int i = 0; i < replacements.size(); i++) {
      insertRun(index + i, replacements.get(i));
    }
  }

  public void removeRun(Run run) {
    int index = indexOf(run);
    if (index >= 0) {
      runs.remove(index);
      run.attachTo(null);
    }
  }

  /** Identity-based position of the run, or -1. */
  public int indexOf(Run run) {
    for (int i = 0; i < runs.size(); i++) {
      if (runs.get(i) == run) {
        return i;
      }
    }
    return -1;
  }

  public boolean isEmpty() {
    return runs.isEmpty();
  }

  public Run firstRun() {
    return runs.isEmpty() ? null : runs.get(0);
  }

  public Run lastRun() {
    return runs.isEmpty() ? null : runs.get(runs.size() - 1);
  }

  public String text() {
    StringBuilder text = new StringBuilder();
    runs.forEach(run -> text.append(run.getText()));
    return text.toString();
  }

  void attachTo(RichDocument owner) {
    this.document = owner;
  }

  private static void detach(Run run) {
    Paragraph current = run.getParagraph();
    if (current != null) {
      current.removeRun(run);
    }
  }
}
