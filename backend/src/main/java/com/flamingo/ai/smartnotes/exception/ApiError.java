package com.flamingo.ai.smartnotes.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_INPUT_INVALID = "DOCUMENT_002";
  public static final String EXTRACTION_INSUFFICIENT = "DOCUMENT_003";
  public static final String TOPIC_NOT_FOUND = "TOPIC_001";
  public static final String MERGE_TARGET_INVALID = "TOPIC_002";
  public static final String NOTE_NOT_FOUND = "NOTE_001";
  public static final String STALE_TARGET = "NOTE_002";
  public static final String DOCUMENT_BUSY = "CONCURRENCY_001";
  public static final String COLLABORATOR_UNAVAILABLE = "COLLABORATOR_001";
  public static final String COLLABORATOR_FAILED = "COLLABORATOR_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
