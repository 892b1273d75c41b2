package com.flamingo.richtext.service.render;

import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Run;
import com.flamingo.richtext.exception.RenderException;
import com.flamingo.richtext.service.addressing.AddressResolver;
import com.flamingo.richtext.service.engine.DocumentEngine;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives single-paragraph patches. Every method may return empty, in which case the caller must
 * render the whole page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatchExtractor {

  private final DocumentEngine documentEngine;

  /** Renders the paragraph containing {@code address}. */
  public Optional<ParagraphPatch> paragraphPatch(
      RichDocument document, AddressResolver resolver, String address) {
    Optional<Paragraph> paragraph = containingParagraph(resolver, address);
    if (paragraph.isEmpty()) {
      return Optional.empty();
    }
    int index = document.indexOf(paragraph.get());
    if (index < 0) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new ParagraphPatch(
              index, address, documentEngine.renderParagraph(paragraph.get(), resolver)));
    } catch (RenderException e) {
      log.warn("Paragraph patch failed for {}, falling back: {}", address, e.getMessage());
      return Optional.empty();
    }
  }

  /** Renders the shared paragraph if both addresses lie in the same one. */
  public Optional<ParagraphPatch> rangePatch(
      RichDocument document, AddressResolver resolver, String startAddress, String endAddress) {
    Optional<Paragraph> start = containingParagraph(resolver, startAddress);
    Optional<Paragraph> end = containingParagraph(resolver, endAddress);
    if (start.isEmpty() || end.isEmpty() || start.get() != end.get()) {
      return Optional.empty();
    }
    return paragraphPatch(document, resolver, startAddress);
  }

  private static Optional<Paragraph> containingParagraph(AddressResolver resolver, String address) {
    return resolver.resolve(address).map(Run::getParagraph);
  }
}
