package com.flamingo.ai.smartnotes.exception;

import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;

/** Exception thrown when an external collaborator call fails. */
public class CollaboratorException extends RuntimeException {

  private final CollaboratorType collaborator;
  private final String operation;
  private final boolean retriable;
  private final String userMessage;

  public CollaboratorException(
      CollaboratorType collaborator, String operation, String message, boolean retriable) {
    this(collaborator, operation, message, retriable, null);
  }

  public CollaboratorException(
      CollaboratorType collaborator,
      String operation,
      String message,
      boolean retriable,
      Throwable cause) {
    super(collaborator + "/" + operation + ": " + message, cause);
    this.collaborator = collaborator;
    this.operation = operation;
    this.retriable = retriable;
    this.userMessage =
        retriable
            ? "The "
                + collaborator.getDisplayName()
                + " is temporarily unavailable. Please try again in a moment."
            : "The " + collaborator.getDisplayName() + " could not complete the request.";
  }

  public CollaboratorType getCollaborator() {
    return collaborator;
  }

  public String getOperation() {
    return operation;
  }

  public boolean isRetriable() {
    return retriable;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
