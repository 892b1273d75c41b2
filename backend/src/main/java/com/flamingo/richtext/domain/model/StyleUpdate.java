package com.flamingo.richtext.domain.model;

import com.flamingo.richtext.domain.enums.Alignment;

/**
 * Partial formatting update. Every field is optional; {@code null} leaves the attribute unchanged.
 *
 * @param fontName font family
 * @param fontSize size in points, ignored unless positive
 * @param color {@code #RRGGBB}
 * @param alignment paragraph alignment
 * @param firstLineIndent paragraph first-line indent in points
 * @param bold bold flag
 * @param italic italic flag
 */
public record StyleUpdate(
    String fontName,
    Double fontSize,
    String color,
    Alignment alignment,
    Double firstLineIndent,
    Boolean bold,
    Boolean italic) {

  public static StyleUpdate empty() {
    return new StyleUpdate(null, null, null, null, null, null, null);
  }

  public static StyleUpdate color(String color) {
    return new StyleUpdate(null, null, color, null, null, null, null);
  }

  public boolean hasParagraphAttributes() {
    return alignment != null || firstLineIndent != null;
  }
}
