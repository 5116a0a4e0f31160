package com.flamingo.ai.smartnotes.exception;

import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import java.time.Duration;

/** Exception thrown when a collaborator call exceeds its time limit. */
public class CollaboratorTimeoutException extends CollaboratorException {

  private final Duration timeout;

  public CollaboratorTimeoutException(
      CollaboratorType collaborator, String operation, Duration timeout, Throwable cause) {
    super(collaborator, operation, "timed out after " + timeout.toMillis() + " ms", true, cause);
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
