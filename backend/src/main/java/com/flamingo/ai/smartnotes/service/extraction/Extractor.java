package com.flamingo.ai.smartnotes.service.extraction;

import com.flamingo.ai.smartnotes.domain.model.ExtractedContent;
import java.io.InputStream;

/** Turns an uploaded file into plain text. */
public interface Extractor {

  /**
   * @throws com.flamingo.ai.smartnotes.exception.CollaboratorException if the file cannot be
   *     parsed
   * @throws com.flamingo.ai.smartnotes.exception.ExtractionInsufficientException if no text was
   *     found
   */
  ExtractedContent extract(InputStream inputStream, String fileName, String mimeType);
}
