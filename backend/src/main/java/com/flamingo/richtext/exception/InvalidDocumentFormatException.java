package com.flamingo.richtext.exception;

/** Exception thrown when uploaded bytes cannot be parsed as a document. */
public class InvalidDocumentFormatException extends RuntimeException {

  private final String userMessage;

  public InvalidDocumentFormatException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Invalid document format";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
