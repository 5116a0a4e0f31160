package com.flamingo.ai.smartnotes.exception;

/** Exception thrown when an operation targets an out-of-date note or topic version. */
public class StaleTargetException extends RuntimeException {

  private final String topicKey;
  private final String userMessage;

  public StaleTargetException(String topicKey, String reason) {
    super("Stale target " + topicKey + ": " + reason);
    this.topicKey = topicKey;
    this.userMessage = reason;
  }

  public String getTopicKey() {
    return topicKey;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
