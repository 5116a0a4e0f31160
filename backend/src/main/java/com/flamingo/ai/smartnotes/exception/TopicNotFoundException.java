package com.flamingo.ai.smartnotes.exception;

import java.util.UUID;

/** Exception thrown when a topic key is unknown to a document. */
public class TopicNotFoundException extends RuntimeException {

  private final UUID documentId;
  private final String topicKey;

  public TopicNotFoundException(UUID documentId, String topicKey) {
    super("Topic not found: " + topicKey + " in document " + documentId);
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
