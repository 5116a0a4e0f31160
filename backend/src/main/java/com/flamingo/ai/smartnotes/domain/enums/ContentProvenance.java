package com.flamingo.ai.smartnotes.domain.enums;

/** Where a note section's content came from. */
public enum ContentProvenance {
  SOURCE,
  ENRICHMENT,
  REVISION
}
