package com.flamingo.ai.smartnotes.domain.enums;

/** State of a document's revision session. */
public enum RevisionState {
  IDLE,
  AWAITING_RESPONSE
}
