package com.flamingo.richtext.service.engine;

import com.flamingo.richtext.domain.enums.Alignment;
import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.ParagraphFormat;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Run;
import com.flamingo.richtext.domain.model.RunFormat;
import com.flamingo.richtext.exception.InvalidDocumentFormatException;
import com.flamingo.richtext.exception.RenderException;
import com.flamingo.richtext.service.addressing.AddressResolver;
import com.flamingo.richtext.service.editing.FormatApplier;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentEngine} backed by Apache POI for DOCX and {@link HtmlRenderer} for HTML.
 *
 * <p>Reads and writes body-level paragraphs with alignment and first-line indent, and their runs
 * with text, font family, size, bold, italic and color. Bookmarks and other markup in the source
 * file are not carried into the model, so stale identifiers never collide with minted addresses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoiDocumentEngine implements DocumentEngine {

  static final String DOCX_CONTENT_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  private static final int TWIPS_PER_POINT = 20;

  private final HtmlRenderer htmlRenderer;

  @Override
  public RichDocument createDocument(List<String> lines) {
    RichDocument document = new RichDocument();
    for (String line : lines) {
      Paragraph paragraph = new Paragraph();
      paragraph.appendRun(new Run(line));
      document.appendParagraph(paragraph);
    }
    return document;
  }

  @Override
  public RichDocument load(byte[] content) {
    if (content == null || content.length == 0) {
      throw new InvalidDocumentFormatException("Document is empty", null);
    }
    try (XWPFDocument source = new XWPFDocument(new ByteArrayInputStream(content))) {
      RichDocument document = new RichDocument();
      for (XWPFParagraph sourceParagraph : source.getParagraphs()) {
        document.appendParagraph(toParagraph(sourceParagraph));
      }
      log.debug("Loaded DOCX with {} paragraphs", document.paragraphCount());
      return document;
    } catch (IOException | RuntimeException e) {
      log.error("Failed to load document: {}", e.getMessage());
      throw new InvalidDocumentFormatException("Failed to parse document: " + e.getMessage(), e);
    }
  }

  @Override
  public byte[] export(RichDocument document) {
    try (XWPFDocument target = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (Paragraph paragraph : document.getParagraphs()) {
        writeParagraph(target.createParagraph(), paragraph);
      }
      target.write(out);
      return out.toByteArray();
    } catch (IOException | RuntimeException e) {
      log.error("Failed to export document: {}", e.getMessage(), e);
      throw new RenderException("Failed to export document: " + e.getMessage(), e);
    }
  }

  @Override
  public String renderHtml(List<Paragraph> paragraphs, AddressResolver resolver) {
    try {
      return htmlRenderer.renderPage(paragraphs, resolver);
    } catch (RuntimeException e) {
      throw new RenderException("Failed to render document: " + e.getMessage(), e);
    }
  }

  @Override
  public String renderParagraph(Paragraph paragraph, AddressResolver resolver) {
    try {
      return htmlRenderer.renderFragment(paragraph, resolver);
    } catch (RuntimeException e) {
      throw new RenderException("Failed to render paragraph: " + e.getMessage(), e);
    }
  }

  @Override
  public String contentType() {
    return DOCX_CONTENT_TYPE;
  }

  @Override
  public String exportFileName() {
    return "modified_document.docx";
  }

  private static Paragraph toParagraph(XWPFParagraph source) {
    ParagraphFormat format = new ParagraphFormat();
    format.setAlignment(toAlignment(source.getAlignment()));
    int indent = source.getIndentationFirstLine();
    if (indent > 0) {
      format.setFirstLineIndent((double) indent / TWIPS_PER_POINT);
    }

    Paragraph paragraph = new Paragraph(format);
    for (XWPFRun sourceRun : source.getRuns()) {
      String text = sourceRun.text();
      if (text == null || text.isEmpty()) {
        continue;
      }
      paragraph.appendRun(new Run(text, toRunFormat(sourceRun)));
    }
    // blank lines still need one addressable run for the caret
    if (paragraph.getRuns().isEmpty()) {
      paragraph.appendRun(new Run(""));
    }
    return paragraph;
  }

  private static RunFormat toRunFormat(XWPFRun source) {
    RunFormat format = new RunFormat();
    format.setFontName(source.getFontFamily());
    format.setFontSize(source.getFontSizeAsDouble());
    if (source.isBold()) {
      format.setBold(true);
    }
    if (source.isItalic()) {
      format.setItalic(true);
    }
    if (source.getColor() != null) {
      FormatApplier.normalizeColor("#" + source.getColor()).ifPresent(format::setColor);
    }
    return format;
  }

  private static void writeParagraph(XWPFParagraph target, Paragraph paragraph) {
    ParagraphFormat format = paragraph.getFormat();
    if (format.getAlignment() != null) {
      target.setAlignment(toPoiAlignment(format.getAlignment()));
    }
    if (format.getFirstLineIndent() != null) {
      target.setIndentationFirstLine(
          (int) Math.round(format.getFirstLineIndent() * TWIPS_PER_POINT));
    }
    for (Run run : paragraph.getRuns()) {
      XWPFRun targetRun = target.createRun();
      targetRun.setText(run.getText());
      RunFormat runFormat = run.getFormat();
      if (runFormat.getFontName() != null) {
        targetRun.setFontFamily(runFormat.getFontName());
      }
      if (runFormat.getFontSize() != null) {
        targetRun.setFontSize(runFormat.getFontSize());
      }
      if (runFormat.getBold() != null) {
        targetRun.setBold(runFormat.getBold());
      }
      if (runFormat.getItalic() != null) {
        targetRun.setItalic(runFormat.getItalic());
      }
      if (runFormat.getColor() != null) {
        targetRun.setColor(runFormat.getColor().substring(1).toUpperCase(Locale.ROOT));
      }
    }
  }

  // LEFT is POI's answer for an unset alignment, so it maps to "inherit"
  private static Alignment toAlignment(ParagraphAlignment alignment) {
    if (alignment == null) {
      return null;
    }
    return switch (alignment) {
      case CENTER -> Alignment.CENTER;
      case RIGHT, END -> Alignment.RIGHT;
      case BOTH, DISTRIBUTE -> Alignment.JUSTIFY;
      default -> null;
    };
  }

  private static ParagraphAlignment toPoiAlignment(Alignment alignment) {
    return switch (alignment) {
      case LEFT -> ParagraphAlignment.LEFT;
      case CENTER -> ParagraphAlignment.CENTER;
      case RIGHT -> ParagraphAlignment.RIGHT;
      case JUSTIFY -> ParagraphAlignment.BOTH;
    };
  }
}
