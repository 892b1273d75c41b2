package com.flamingo.richtext.exception;

/** Exception thrown when the document engine fails to render or serialize a document. */
public class RenderException extends RuntimeException {

  private final String userMessage;

  public RenderException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to render document";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
