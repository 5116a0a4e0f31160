package com.flamingo.ai.smartnotes.exception;

/** Exception thrown when user-supplied input cannot be processed. */
public class InputException extends RuntimeException {

  private final String userMessage;

  public InputException(String message) {
    this(message, message);
  }

  public InputException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
