package com.flamingo.richtext.service.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.richtext.domain.enums.Alignment;
import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.ParagraphFormat;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Run;
import com.flamingo.richtext.domain.model.RunFormat;
import com.flamingo.richtext.service.addressing.AddressResolver;
import java.io.IOException;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Encodes a document together with its address bindings into a {@link HistorySnapshot}, and
 * rebuilds both from one. Addresses survive a round trip so clients keep addressing runs after
 * undo and redo.
 */
@Component
public class DocumentSnapshotCodec {

  private final ObjectMapper objectMapper =
      new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public HistorySnapshot capture(RichDocument document, AddressResolver resolver) {
    List<ParagraphState> paragraphs =
        document.getParagraphs().stream().map(p -> toState(p, resolver)).toList();
    try {
      return new HistorySnapshot(objectMapper.writeValueAsBytes(new DocumentState(paragraphs)));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode document snapshot", e);
    }
  }

  /**
   * Rebuilds the document captured in {@code snapshot}. {@code resolver} is cleared and rebound
   * to the restored runs.
   */
  public RichDocument restore(HistorySnapshot snapshot, AddressResolver resolver) {
    DocumentState state;
    try {
      state = objectMapper.readValue(snapshot.payload(), DocumentState.class);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to decode document snapshot", e);
    }

    resolver.clear();
    RichDocument document = new RichDocument();
    for (ParagraphState paragraphState : state.paragraphs()) {
      ParagraphFormat format = new ParagraphFormat();
      format.setAlignment(paragraphState.alignment());
      format.setFirstLineIndent(paragraphState.firstLineIndent());
      Paragraph paragraph = new Paragraph(format);
      for (RunState runState : paragraphState.runs()) {
        Run run = new Run(runState.text(), toFormat(runState));
        paragraph.appendRun(run);
        if (runState.address() != null) {
          resolver.bind(run, runState.address());
        }
      }
      document.appendParagraph(paragraph);
    }
    return document;
  }

  private static ParagraphState toState(Paragraph paragraph, AddressResolver resolver) {
    List<RunState> runs =
        paragraph.getRuns().stream()
            .map(
                run ->
                    new RunState(
                        resolver.addressOf(run).orElse(null),
                        run.getText(),
                        run.getFormat().getFontName(),
                        run.getFormat().getFontSize(),
                        run.getFormat().getBold(),
                        run.getFormat().getItalic(),
                        run.getFormat().getColor()))
            .toList();
    return new ParagraphState(
        paragraph.getFormat().getAlignment(), paragraph.getFormat().getFirstLineIndent(), runs);
  }

  private static RunFormat toFormat(RunState state) {
    RunFormat format = new RunFormat();
    format.setFontName(state.fontName());
    format.setFontSize(state.fontSize());
    format.setBold(state.bold());
    format.setItalic(state.italic());
    format.setColor(state.color());
    return format;
  }

  record DocumentState(List<ParagraphState> paragraphs) {}

  record ParagraphState(Alignment alignment, Double firstLineIndent, List<RunState> runs) {}

  record RunState(
      String address,
      String text,
      String fontName,
      Double fontSize,
      Boolean bold,
      Boolean italic,
      String color) {}
}
