package com.flamingo.richtext.service.engine;

import com.flamingo.richtext.domain.model.Paragraph;
import com.flamingo.richtext.domain.model.ParagraphFormat;
import com.flamingo.richtext.domain.model.Run;
import com.flamingo.richtext.domain.model.RunFormat;
import com.flamingo.richtext.service.addressing.AddressResolver;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Builds HTML for paragraphs with jsoup.
 *
 * <p>Each paragraph becomes a {@code <p>} carrying its alignment and indent inline; each addressed
 * run becomes {@code <a name="ADDRESS"><span style="...">text</span></a>}. Only attributes set on
 * the run appear in its style, so a run with default formatting renders a bare {@code <span>}.
 */
@Component
public class HtmlRenderer {

  public String renderPage(List<Paragraph> paragraphs, AddressResolver resolver) {
    Document page = Document.createShell("");
    page.outputSettings().prettyPrint(false);
    page.charset(StandardCharsets.UTF_8);
    for (Paragraph paragraph : paragraphs) {
      page.body().appendChild(toElement(paragraph, resolver));
    }
    return page.outerHtml();
  }

  public String renderFragment(Paragraph paragraph, AddressResolver resolver) {
    Document holder = Document.createShell("");
    holder.outputSettings().prettyPrint(false);
    Element element = toElement(paragraph, resolver);
    holder.body().appendChild(element);
    return element.outerHtml();
  }

  private Element toElement(Paragraph paragraph, AddressResolver resolver) {
    Element p = new Element("p");
    String paragraphStyle = paragraphStyle(paragraph.getFormat());
    if (!paragraphStyle.isEmpty()) {
      p.attr("style", paragraphStyle);
    }
    for (Run run : paragraph.getRuns()) {
      Element span = new Element("span");
      String runStyle = runStyle(run.getFormat());
      if (!runStyle.isEmpty()) {
        span.attr("style", runStyle);
      }
      span.text(run.getText());

      Optional<String> address = resolver.addressOf(run);
      if (address.isPresent()) {
        p.appendElement("a").attr("name", address.get()).appendChild(span);
      } else {
        p.appendChild(span);
      }
    }
    return p;
  }

  static String paragraphStyle(ParagraphFormat format) {
    List<String> declarations = new ArrayList<>();
    if (format.getAlignment() != null) {
      declarations.add("text-align:" + format.getAlignment().cssValue());
    }
    if (format.getFirstLineIndent() != null) {
      declarations.add("text-indent:" + points(format.getFirstLineIndent()));
    }
    return String.join(";", declarations);
  }

  static String runStyle(RunFormat format) {
    List<String> declarations = new ArrayList<>();
    if (format.getFontName() != null) {
      declarations.add("font-family:'" + format.getFontName() + "'");
    }
    if (format.getFontSize() != null) {
      declarations.add("font-size:" + points(format.getFontSize()));
    }
    if (Boolean.TRUE.equals(format.getBold())) {
      declarations.add("font-weight:bold");
    }
    if (Boolean.TRUE.equals(format.getItalic())) {
      declarations.add("font-style:italic");
    }
    if (format.getColor() != null) {
      declarations.add("color:" + format.getColor());
    }
    return String.join(";", declarations);
  }

  private static String points(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString() + "pt";
  }
}
