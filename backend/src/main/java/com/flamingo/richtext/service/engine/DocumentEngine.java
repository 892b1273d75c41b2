package com.flamingo.richtext.service.engine;

import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.service.addressing.AddressResolver;
import java.util.List;

/**
 * Rich-text document engine: parsing, serialization and rendering of the document tree.
 *
 * <p>The editing core treats it as an opaque capability and never reaches into its formats.
 * Implementations must be stateless so one instance can serve every editor session.
 */
public interface DocumentEngine {

  /**
   * Builds a document with one single-run paragraph per line.
   *
   * @param lines paragraph texts
   * @return the new document
   */
  RichDocument createDocument(List<String> lines);

  /**
   * Parses a document in the engine's native format.
   *
   * @param content raw bytes
   * @return the parsed document, with no addresses bound
   * @throws com.flamingo.richtext.exception.InvalidDocumentFormatException if unparseable
   */
  RichDocument load(byte[] content);

  /**
   * Serializes a document to the engine's native format.
   *
   * @param document the document
   * @return the serialized bytes
   * @throws com.flamingo.richtext.exception.RenderException if serialization fails
   */
  byte[] export(RichDocument document);

  /**
   * Renders paragraphs as a standalone HTML page. Addressed runs are wrapped in named anchors.
   *
   * @param paragraphs the paragraphs to render, in order
   * @param resolver supplies run addresses
   * @return the HTML
   * @throws com.flamingo.richtext.exception.RenderException if rendering fails
   */
  String renderHtml(List<Paragraph> paragraphs, AddressResolver resolver);

  /**
   * Renders one paragraph as an HTML fragment ({@code <p>...</p>}).
   *
   * @param paragraph the paragraph
   * @param resolver supplies run addresses
   * @return the fragment
   * @throws com.flamingo.richtext.exception.RenderException if rendering fails
   */
  String renderParagraph(Paragraph paragraph, AddressResolver resolver);

  /** MIME type of {@link #export} output. */
  String contentType();

  /** Suggested file name for {@link #export} output. */
  String exportFileName();
}
