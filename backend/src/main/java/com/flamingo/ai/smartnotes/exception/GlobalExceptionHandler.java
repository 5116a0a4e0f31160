package com.flamingo.ai.smartnotes.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private static final String RETRY_AFTER_SECONDS = "1";

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return error(HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND,
        "Document not found", request);
  }

  @ExceptionHandler(TopicNotFoundException.class)
  public ResponseEntity<ApiError> handleTopicNotFound(
      TopicNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("topic_not_found");
    String errorId = generateErrorId();
    log.warn("Topic not found [{}]: {}", errorId, ex.getMessage());

    return error(HttpStatus.NOT_FOUND, errorId, ApiError.TOPIC_NOT_FOUND,
        "Topic " + ex.getTopicKey() + " does not exist", request);
  }

  @ExceptionHandler(NoteNotFoundException.class)
  public ResponseEntity<ApiError> handleNoteNotFound(
      NoteNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("note_not_found");
    String errorId = generateErrorId();
    log.warn("Note not found [{}]: {}", errorId, ex.getMessage());

    return error(HttpStatus.NOT_FOUND, errorId, ApiError.NOTE_NOT_FOUND,
        "Topic " + ex.getTopicKey() + " has no notes yet", request);
  }

  @ExceptionHandler(StaleTargetException.class)
  public ResponseEntity<ApiError> handleStaleTarget(
      StaleTargetException ex, HttpServletRequest request) {

    incrementErrorCounter("stale_target");
    String errorId = generateErrorId();
    log.info("Stale target [{}]: {}", errorId, ex.getMessage());

    return error(HttpStatus.CONFLICT, errorId, ApiError.STALE_TARGET, ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ConcurrencyException.class)
  public ResponseEntity<ApiError> handleConcurrency(
      ConcurrencyException ex, HttpServletRequest request) {

    incrementErrorCounter("document_busy");
    String errorId = generateErrorId();
    log.info("Document busy [{}]: {}", errorId, ex.getDocumentId());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_BUSY)
                .message("The document is being updated by another request. Please retry.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(InputException.class)
  public ResponseEntity<ApiError> handleInput(InputException ex, HttpServletRequest request) {

    String code;
    if (ex instanceof ExtractionInsufficientException) {
      code = ApiError.EXTRACTION_INSUFFICIENT;
    } else if (ex instanceof MergeTargetInvalidException) {
      code = ApiError.MERGE_TARGET_INVALID;
    } else {
      code = ApiError.DOCUMENT_INPUT_INVALID;
    }
    incrementErrorCounter("input_invalid");
    String errorId = generateErrorId();
    log.warn("Invalid input [{}]: {}", errorId, ex.getMessage());

    return error(HttpStatus.BAD_REQUEST, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(CollaboratorException.class)
  public ResponseEntity<ApiError> handleCollaborator(
      CollaboratorException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isRetriable() ? "collaborator_unavailable" : "collaborator_failed");
    String errorId = generateErrorId();
    log.error("Collaborator error [{}]: {}", errorId, ex.getMessage(), ex);

    HttpStatus status = ex.isRetriable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
    String code =
        ex.isRetriable() ? ApiError.COLLABORATOR_UNAVAILABLE : ApiError.COLLABORATOR_FAILED;
    return error(status, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(InvariantViolationException.class)
  public ResponseEntity<ApiError> handleInvariantViolation(
      InvariantViolationException ex, HttpServletRequest request) {

    incrementErrorCounter("invariant_violation");
    String errorId = generateErrorId();
    log.error("Invariant violation [{}]: {}", errorId, ex.getMessage(), ex);

    return error(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.", request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Illegal argument [{}]: {}", errorId, ex.getMessage());

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return error(HttpStatus.PAYLOAD_TOO_LARGE, errorId, ApiError.DOCUMENT_INPUT_INVALID,
        "The uploaded file is too large", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.", request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status, String errorId, String code, String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
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
