package com.flamingo.ai.smartnotes.exception;

import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;

/** Exception thrown when the core summarization step for a note fails. */
public class SynthesisFailedException extends CollaboratorException {

  private final String topicKey;

  public SynthesisFailedException(
      String topicKey, String message, boolean retriable, Throwable cause) {
    super(
        CollaboratorType.LANGUAGE_MODEL,
        "summarize",
        "note for " + topicKey + ": " + message,
        retriable,
        cause);
    this.topicKey = topicKey;
  }

  public String getTopicKey() {
    return topicKey;
  }
}
