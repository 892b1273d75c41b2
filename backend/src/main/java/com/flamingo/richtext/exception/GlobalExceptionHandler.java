package com.flamingo.richtext.exception;

import com.flamingo.richtext.api.dto.response.EditorResponse;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  /** Conflicts answer with the document's current state rather than an {@link ApiError}. */
  @ExceptionHandler(DocumentConflictException.class)
  public ResponseEntity<EditorResponse> handleConflict(DocumentConflictException ex) {
    incrementErrorCounter(ex.getCheck().errorCode());
    log.info("Rejected stale mutation: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getCurrentState());
  }

  @ExceptionHandler(AddressNotFoundException.class)
  public ResponseEntity<ApiError> handleAddressNotFound(
      AddressNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("address_not_found");
    String errorId = generateErrorId();
    log.warn("Address not found [{}]: {}", errorId, ex.getAddresses());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.ADDRESS_NOT_FOUND)
                .message("Address not found")
                .details(String.join(",", ex.getAddresses()))
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(InvalidDocumentFormatException.class)
  public ResponseEntity<ApiError> handleInvalidDocument(
      InvalidDocumentFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_document");
    String errorId = generateErrorId();
    log.warn("Invalid document upload [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_PARSE_ERROR)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(RenderException.class)
  public ResponseEntity<ApiError> handleRender(RenderException ex, HttpServletRequest request) {

    incrementErrorCounter("render_error");
    String errorId = generateErrorId();
    log.error("Render error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.RENDER_FAILED)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    return validationError(message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
    return validationError("Malformed request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> validationError(String message, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
