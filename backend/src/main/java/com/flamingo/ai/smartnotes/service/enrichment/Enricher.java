package com.flamingo.ai.smartnotes.service.enrichment;

/** Supplies background material for a topic whose source text is thin. */
public interface Enricher {

  /**
   * @param topicName the topic's name
   * @param topicSummary what the document says about it
   * @return supplementary Markdown text, never blank
   * @throws com.flamingo.ai.smartnotes.exception.CollaboratorException when enrichment is
   *     unavailable
   */
  String supplement(String topicName, String topicSummary);
}
