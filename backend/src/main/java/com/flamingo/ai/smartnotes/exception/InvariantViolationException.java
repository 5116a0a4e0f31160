package com.flamingo.ai.smartnotes.exception;

/**
 * Exception thrown when an operation would break the topic graph's structural invariants. Always
 * an internal defect; the detail is logged and never shown to users.
 */
public class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }
}
