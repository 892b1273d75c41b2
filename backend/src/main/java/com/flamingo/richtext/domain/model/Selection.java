package com.flamingo.richtext.domain.model;

/**
 * A range between two stable-address positions. A collapsed selection is a caret.
 *
 * @param startNodeId address of the run holding the start
 * @param startOffset offset inside the start run
 * @param endNodeId address of the run holding the end
 * @param endOffset offset inside the end run
 */
public record Selection(String startNodeId, int startOffset, String endNodeId, int endOffset) {

  public static Selection collapsed(Caret caret) {
    return new Selection(caret.address(), caret.offset(), caret.address(), caret.offset());
  }
}
