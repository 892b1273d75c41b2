package com.flamingo.richtext.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Horizontal alignment of a paragraph. */
public enum Alignment {
  LEFT("left"),
  CENTER("center"),
  RIGHT("right"),
  JUSTIFY("justify");

  private final String cssValue;

  Alignment(String cssValue) {
    this.cssValue = cssValue;
  }

  /** Value used for the CSS {@code text-align} property and on the wire. */
  @JsonValue
  public String cssValue() {
    return cssValue;
  }

  /**
   * Parses a wire value such as {@code "center"}.
   *
   * @param value the value, case-insensitive
   * @return the alignment
   * @throws IllegalArgumentException if the value is not one of left, center, right, justify
   */
  @JsonCreator
  public static Alignment fromValue(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Alignment alignment : values()) {
      if (alignment.cssValue.equals(normalized)) {
        return alignment;
      }
    }
    throw new IllegalArgumentException("Unknown alignment: " + value);
  }
}
