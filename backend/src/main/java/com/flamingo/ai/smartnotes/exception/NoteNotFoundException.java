package com.flamingo.ai.smartnotes.exception;

import java.util.UUID;

/** Exception thrown when a live topic has no note yet. */
public class NoteNotFoundException extends RuntimeException {

  private final UUID documentId;
  private final String topicKey;

  public NoteNotFoundException(UUID documentId, String topicKey) {
    super("No note for topic " + topicKey + " in document " + documentId);
    this.documentId = documentId;
    this.topicKey = topicKey;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getTopicKey() {
    return topicKey;
  }
}
