package com.flamingo.ai.smartnotes.exception;

import java.util.UUID;

/** Exception thrown when a document is already under a mutating operation. */
public class ConcurrencyException extends RuntimeException {

  private final UUID documentId;

  public ConcurrencyException(UUID documentId) {
    super("Document is busy: " + documentId);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
