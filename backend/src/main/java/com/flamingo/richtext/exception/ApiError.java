package com.flamingo.richtext.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String ADDRESS_NOT_FOUND = "ADDRESS_001";
  public static final String DOCUMENT_PARSE_ERROR = "DOCUMENT_002";
  public static final String RENDER_FAILED = "RENDER_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
