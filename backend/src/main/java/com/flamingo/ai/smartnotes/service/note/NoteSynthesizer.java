package com.flamingo.ai.smartnotes.service.note;

import com.flamingo.ai.smartnotes.domain.model.SynthesisOptions;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;

/** Expands a topic into an enriched, rendered, cross-linked note. */
public interface NoteSynthesizer {

  /**
   * Builds a note for a live topic without modifying the document.
   *
   * @throws com.flamingo.ai.smartnotes.exception.SynthesisFailedException when the core
   *     summarization step fails
   */
  SynthesizedNote synthesize(Topic topic, DocumentWorkspace document, SynthesisOptions options);
}
