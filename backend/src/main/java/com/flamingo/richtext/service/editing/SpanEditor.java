package com.flamingo.richtext.service.editing;

import com.flamingo.richtext.domain.model.Caret;
import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Run;
import com.flamingo.richtext.domain.model.Selection;
import com.flamingo.richtext.domain.model.StyleUpdate;
import com.flamingo.richtext.service.addressing.AddressResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Text and style mutations over address-located spans.
 *
 * <p>Every split follows the carry-over rule: the original address moves to the one produced
 * segment that represents the primary edited text, the other segments get fresh addresses, and
 * empty segments are never materialized. Runs outside the edited range keep their addresses.
 *
 * <p>An address that does not resolve makes the operation a no-op that reports the caller's
 * position back unchanged.
 */
@Component
@Slf4j
public class SpanEditor {

  /** Applies character attributes to every run and paragraph attributes to every paragraph. */
  public void updateDocumentStyle(RichDocument document, StyleUpdate style) {
    for (Paragraph paragraph : document.getParagraphs()) {
      FormatApplier.applyParagraph(paragraph.getFormat(), style);
      paragraph.getRuns().forEach(run -> FormatApplier.applyRun(run.getFormat(), style));
    }
  }

  /**
   * Styles the text between two positions.
   *
   * @return the styled range expressed against the post-edit addresses, or empty for a no-op
   */
  public Optional<Selection> updateRangeStyle(
      RichDocument document,
      AddressResolver resolver,
      String startAddress,
      int startOffset,
      String endAddress,
      int endOffset,
      StyleUpdate style) {
    Optional<Run> startRun = resolver.resolve(startAddress);
    Optional<Run> endRun = resolver.resolve(endAddress);
    if (startRun.isEmpty() || endRun.isEmpty()) {
      log.debug("Range style skipped, unresolved address: {} / {}", startAddress, endAddress);
      return Optional.empty();
    }

    if (startRun.get() == endRun.get()) {
      return styleWithinRun(resolver, startRun.get(), startAddress, startOffset, endOffset, style);
    }
    if (document.runIndex(endRun.get()) < document.runIndex(startRun.get())) {
      return styleAcrossRuns(
          document,
          resolver,
          endRun.get(),
          endAddress,
          endOffset,
          startRun.get(),
          startAddress,
          startOffset,
          style);
    }
    return styleAcrossRuns(
        document,
        resolver,
        startRun.get(),
        startAddress,
        startOffset,
        endRun.get(),
        endAddress,
        endOffset,
        style);
  }

  /**
   * Inserts text at a caret. The inserted text becomes its own run carrying {@code address} and
   * the optional style override.
   *
   * @return the caret just after the inserted text
   */
  public Caret insertText(
      AddressResolver resolver, String address, int offset, String text, StyleUpdate style) {
    Optional<Run> resolved = resolver.resolve(address);
    if (resolved.isEmpty()) {
      log.debug("Insert skipped, unresolved address: {}", address);
      return new Caret(address, offset);
    }
    if (text == null || text.isEmpty()) {
      return new Caret(address, offset);
    }

    Run run = resolved.get();
    int at = clampToText(run.getText(), offset);
    if (run.isEmpty() && at == 0) {
      run.setText(text);
      FormatApplier.applyRun(run.getFormat(), style);
      return new Caret(address, text.length());
    }

    String original = run.getText();
    replaceWithSegments(
        resolver,
        run,
        address,
        List.of(original.substring(0, at), text, original.substring(at)),
        1,
        style);
    return new Caret(address, text.length());
  }

  /**
   * Deletes the text between two positions. Boundary runs are truncated in place and whole runs
   * strictly between them are removed; no address is created or moved.
   *
   * @return the caret at the start of the deleted range
   */
  public Caret deleteRange(
      RichDocument document,
      AddressResolver resolver,
      String startAddress,
      int startOffset,
      String endAddress,
      int endOffset) {
    Optional<Run> startRun = resolver.resolve(startAddress);
    Optional<Run> endRun = resolver.resolve(endAddress);
    if (startRun.isEmpty() || endRun.isEmpty()) {
      log.debug("Delete skipped, unresolved address: {} / {}", startAddress, endAddress);
      return new Caret(startAddress, startOffset);
    }

    Run start = startRun.get();
    Run end = endRun.get();
    if (start == end) {
      int from = clampToText(start.getText(), startOffset);
      int to = clampToText(start.getText(), endOffset);
      if (from < to) {
        String text = start.getText();
        start.setText(text.substring(0, from) + text.substring(to));
      }
      return new Caret(startAddress, from);
    }

    if (document.runIndex(end) < document.runIndex(start)) {
      return deleteRange(document, resolver, endAddress, endOffset, startAddress, startOffset);
    }

    int from = clampToText(start.getText(), startOffset);
    int to = clampToText(end.getText(), endOffset);
    List<Run> runs = document.runs();
    List<Run> between =
        new ArrayList<>(runs.subList(indexOf(runs, start) + 1, indexOf(runs, end)));

    start.setText(start.getText().substring(0, from));
    end.setText(end.getText().substring(to));
    for (Run run : between) {
      resolver.unbindRun(run);
      run.getParagraph().removeRun(run);
    }
    return new Caret(startAddress, from);
  }

  /**
   * Deletes {@code count} characters before the caret, merging paragraphs when the caret crosses
   * a paragraph start.
   */
  public Caret deleteBackward(
      RichDocument document, AddressResolver resolver, String address, int offset, int count) {
    Caret caret = new Caret(address, offset);
    for (int i = 0; i < count; i++) {
      Caret next = stepBackward(document, resolver, caret);
      if (next == null) {
        break;
      }
      caret = next;
    }
    return caret;
  }

  /**
   * Deletes {@code count} characters after the caret, pulling the next paragraph into this one
   * when the caret sits at a paragraph end.
   */
  public Caret deleteForward(
      RichDocument document, AddressResolver resolver, String address, int offset, int count) {
    Caret caret = new Caret(address, offset);
    for (int i = 0; i < count; i++) {
      Caret next = stepForward(document, resolver, caret);
      if (next == null) {
        break;
      }
      caret = next;
    }
    return caret;
  }

  /**
   * Splits the owning paragraph at the caret. Text after the caret moves to a new paragraph and
   * keeps {@code address}; text before it stays behind under a fresh address.
   *
   * @return the caret at the start of the new paragraph
   */
  public Caret insertBreak(
      RichDocument document, AddressResolver resolver, String address, int offset) {
    Optional<Run> resolved = resolver.resolve(address);
    if (resolved.isEmpty()) {
      log.debug("Break skipped, unresolved address: {}", address);
      return new Caret(address, offset);
    }

    Run run = resolved.get();
    Paragraph paragraph = run.getParagraph();
    int at = clampToText(run.getText(), offset);
    int index = paragraph.indexOf(run);
    List<Run> trailing =
        new ArrayList<>(paragraph.getRuns().subList(index + 1, paragraph.getRuns().size()));

    Paragraph created = new Paragraph(paragraph.getFormat().copy());
    document.insertParagraph(document.indexOf(paragraph) + 1, created);

    String text = run.getText();
    String pre = text.substring(0, at);
    if (!pre.isEmpty()) {
      Run preRun = run.withText(pre);
      resolver.bindFresh(preRun);
      paragraph.insertRun(index, preRun);
    }
    run.setText(text.substring(at));
    created.appendRun(run);
    trailing.forEach(created::appendRun);
    return new Caret(address, 0);
  }

  /**
   * Splits {@code run} at ascending offsets into up to {@code offsets.length + 1} segments.
   *
   * @param address the address currently bound to {@code run}
   * @param primaryIndex index of the segment that inherits {@code address}
   * @param style optional override applied to the primary segment only
   */
  public SplitResult splitAtOffsets(
      AddressResolver resolver,
      Run run,
      String address,
      int[] offsets,
      int primaryIndex,
      StyleUpdate style) {
    String text = run.getText();
    List<String> texts = new ArrayList<>(offsets.length + 1);
    int previous = 0;
    for (int offset : offsets) {
      int cut = Math.max(previous, clampToText(text, offset));
      texts.add(text.substring(previous, cut));
      previous = cut;
    }
    texts.add(text.substring(previous));
    return replaceWithSegments(resolver, run, address, texts, primaryIndex, style);
  }

  private SplitResult replaceWithSegments(
      AddressResolver resolver,
      Run run,
      String address,
      List<String> texts,
      int primaryIndex,
      StyleUpdate style) {
    resolver.unbindRun(run);

    List<Run> segments = new ArrayList<>(texts.size());
    List<Run> materialized = new ArrayList<>(texts.size());
    Run primary = null;
    for (int i = 0; i < texts.size(); i++) {
      String segmentText = texts.get(i);
      if (segmentText.isEmpty()) {
        segments.add(null);
        continue;
      }
      Run segment = run.withText(segmentText);
      if (i == primaryIndex) {
        FormatApplier.applyRun(segment.getFormat(), style);
        resolver.bind(segment, address);
        primary = segment;
      } else {
        resolver.bindFresh(segment);
      }
      segments.add(segment);
      materialized.add(segment);
    }
    run.getParagraph().replaceRun(run, materialized);
    return new SplitResult(Collections.unmodifiableList(segments), primary);
  }

  private Optional<Selection> styleWithinRun(
      AddressResolver resolver,
      Run run,
      String address,
      int startOffset,
      int endOffset,
      StyleUpdate style) {
    int length = run.length();
    int from = clampToText(run.getText(), startOffset);
    int to = clampToText(run.getText(), endOffset);
    if (from >= to) {
      return Optional.empty();
    }

    Paragraph paragraph = run.getParagraph();
    FormatApplier.applyParagraph(paragraph.getFormat(), style);
    if (from == 0 && to == length) {
      FormatApplier.applyRun(run.getFormat(), style);
      return Optional.of(new Selection(address, 0, address, length));
    }
    splitAtOffsets(resolver, run, address, new int[] {from, to}, 1, style);
    return Optional.of(new Selection(address, 0, address, to - from));
  }

  private Optional<Selection> styleAcrossRuns(
      RichDocument document,
      AddressResolver resolver,
      Run start,
      String startAddress,
      int startOffset,
      Run end,
      String endAddress,
      int endOffset,
      StyleUpdate style) {
    int startLength = start.length();
    int endLength = end.length();
    int from = clampToText(start.getText(), startOffset);
    int to = clampToText(end.getText(), endOffset);

    // walkFrom and walkTo bound the interior runs (exclusive on both sides)
    Run walkFrom = start;
    int selectionStart = 0;
    if (from == startLength) {
      selectionStart = from;
    } else if (from == 0) {
      FormatApplier.applyRun(start.getFormat(), style);
    } else {
      walkFrom =
          splitAtOffsets(resolver, start, startAddress, new int[] {from}, 1, style).primary();
    }

    Run walkTo = end;
    if (to == endLength) {
      FormatApplier.applyRun(end.getFormat(), style);
    } else if (to > 0) {
      walkTo = splitAtOffsets(resolver, end, endAddress, new int[] {to}, 0, style).primary();
    }

    List<Run> runs = document.runs();
    int fromIndex = indexOf(runs, walkFrom);
    int toIndex = indexOf(runs, walkTo);
    for (int i = fromIndex + 1; i < toIndex; i++) {
      FormatApplier.applyRun(runs.get(i).getFormat(), style);
    }

    if (style.hasParagraphAttributes()) {
      Set<Paragraph> touched = new LinkedHashSet<>();
      for (int i = fromIndex; i <= toIndex; i++) {
        touched.add(runs.get(i).getParagraph());
      }
      touched.forEach(paragraph -> FormatApplier.applyParagraph(paragraph.getFormat(), style));
    }
    return Optional.of(new Selection(startAddress, selectionStart, endAddress, to));
  }

  private Caret stepBackward(RichDocument document, AddressResolver resolver, Caret caret) {
    Optional<Run> resolved = resolver.resolve(caret.address());
    if (resolved.isEmpty()) {
      return null;
    }
    Run run = resolved.get();
    String address = caret.address();
    int at = clampToText(run.getText(), caret.offset());

    while (at == 0) {
      Paragraph paragraph = run.getParagraph();
      int index = paragraph.indexOf(run);
      if (index > 0) {
        run = paragraph.getRuns().get(index - 1);
        at = run.length();
        address = resolver.ensureAddress(run);
        continue;
      }
      Paragraph previous = document.paragraphAt(document.indexOf(paragraph) - 1);
      if (previous == null) {
        return null;
      }
      Run landing = previous.lastRun();
      mergeInto(document, previous, paragraph);
      return landing == null
          ? new Caret(address, 0)
          : new Caret(resolver.ensureAddress(landing), landing.length());
    }

    String text = run.getText();
    int from = text.offsetByCodePoints(at, -1);
    run.setText(text.substring(0, from) + text.substring(at));
    return new Caret(address, from);
  }

  private Caret stepForward(RichDocument document, AddressResolver resolver, Caret caret) {
    Optional<Run> resolved = resolver.resolve(caret.address());
    if (resolved.isEmpty()) {
      return null;
    }
    Run run = resolved.get();
    String address = caret.address();
    int at = clampToText(run.getText(), caret.offset());

    while (at == run.length()) {
      Paragraph paragraph = run.getParagraph();
      int index = paragraph.indexOf(run);
      if (index < paragraph.getRuns().size() - 1) {
        run = paragraph.getRuns().get(index + 1);
        at = 0;
        address = resolver.ensureAddress(run);
        continue;
      }
      Paragraph next = document.paragraphAt(document.indexOf(paragraph) + 1);
      if (next == null) {
        return null;
      }
      mergeInto(document, paragraph, next);
      return new Caret(address, at);
    }

    String text = run.getText();
    int to = text.offsetByCodePoints(at, 1);
    run.setText(text.substring(0, at) + text.substring(to));
    return new Caret(address, at);
  }

  /** Moves every run of {@code source} to the end of {@code target} and drops {@code source}. */
  private void mergeInto(RichDocument document, Paragraph target, Paragraph source) {
    List<Run> moved = new ArrayList<>(source.getRuns());
    moved.forEach(target::appendRun);
    document.removeParagraph(source);
  }

  private static int indexOf(List<Run> runs, Run run) {
    for (int i = 0; i < runs.size(); i++) {
      if (runs.get(i) == run) {
        return i;
      }
    }
    return -1;
  }

  /** Clamps {@code offset} into {@code text}, off the middle of any surrogate pair. */
  private static int clampToText(String text, int offset) {
    int at = Math.max(0, Math.min(offset, text.length()));
    if (at > 0
        && at < text.length()
        && Character.isLowSurrogate(text.charAt(at))
        && Character.isHighSurrogate(text.charAt(at - 1))) {
      return at - 1;
    }
    return at;
  }
}
