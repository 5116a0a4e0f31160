package com.flamingo.ai.smartnotes.domain.enums;

/** External capabilities the engine calls out to. */
public enum CollaboratorType {
  LANGUAGE_MODEL("language model"),
  ENRICHER("enrichment service"),
  IMAGE_ANALYZER("image analysis service"),
  EXTRACTOR("text extraction"),
  RENDERER("note renderer"),
  STORE("document store");

  private final String displayName;

  CollaboratorType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
