package com.flamingo.ai.smartnotes.service.image;

import com.flamingo.ai.smartnotes.domain.model.MediaReference;

/** Describes an image embedded in a document. */
public interface ImageAnalyzer {

  /**
   * @throws com.flamingo.ai.smartnotes.exception.CollaboratorException when analysis is
   *     unavailable or the image cannot be read
   */
  String describe(MediaReference image);
}
