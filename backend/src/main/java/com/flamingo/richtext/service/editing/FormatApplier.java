package com.flamingo.richtext.service.editing;

import com.flamingo.richtext.domain.model.ParagraphFormat;
import com.flamingo.richtext.domain.model.RunFormat;
import com.flamingo.richtext.domain.model.StyleUpdate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** Applies the present fields of a {@link StyleUpdate}; absent fields leave formatting as is. */
@Slf4j
public final class FormatApplier {

  private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

  private FormatApplier() {}

  public static void applyRun(RunFormat format, StyleUpdate style) {
    if (style == null) {
      return;
    }
    if (style.fontName() != null && !style.fontName().isBlank()) {
      format.setFontName(style.fontName());
    }
    if (style.fontSize() != null && style.fontSize() > 0) {
      format.setFontSize(style.fontSize());
    }
    if (style.color() != null) {
      normalizeColor(style.color())
          .ifPresentOrElse(
              format::setColor, () -> log.warn("Ignoring invalid color: {}", style.color()));
    }
    if (style.bold() != null) {
      format.setBold(style.bold());
    }
    if (style.italic() != null) {
      format.setItalic(style.italic());
    }
  }

  public static void applyParagraph(ParagraphFormat format, StyleUpdate style) {
    if (style == null) {
      return;
    }
    if (style.alignment() != null) {
      format.setAlignment(style.alignment());
    }
    if (style.firstLineIndent() != null) {
      format.setFirstLineIndent(style.firstLineIndent());
    }
  }

  /** Returns the color as lower-case {@code #rrggbb}, or empty if it is not a hex color. */
  public static Optional<String> normalizeColor(String color) {
    if (color == null || !HEX_COLOR.matcher(color.trim()).matches()) {
      return Optional.empty();
    }
    return Optional.of(color.trim().toLowerCase(Locale.ROOT));
  }
}
