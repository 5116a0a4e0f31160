package com.flamingo.ai.smartnotes.exception;

import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;

/** Exception thrown when the language model cannot produce a valid segmentation. */
public class SegmentationUpstreamException extends CollaboratorException {

  public SegmentationUpstreamException(String message, boolean retriable, Throwable cause) {
    super(CollaboratorType.LANGUAGE_MODEL, "segment", message, retriable, cause);
  }
}
