package com.flamingo.ai.smartnotes.domain.enums;

/** Lifecycle state of a document. */
public enum DocumentState {
  /** Content extracted, not yet segmented. */
  UPLOADED,
  /** Topics exist; at least one live topic has no fresh note. */
  SEGMENTED,
  /** Every live topic has a fresh note. */
  NOTES_GENERATED
}
