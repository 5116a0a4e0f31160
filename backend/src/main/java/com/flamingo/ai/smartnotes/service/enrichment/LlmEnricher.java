package com.flamingo.ai.smartnotes.service.enrichment;

import com.flamingo.ai.smartnotes.agent.TopicEnrichmentAgent;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link Enricher} that asks the language model for supplementary explanation. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmEnricher implements Enricher {

  private final TopicEnrichmentAgent enrichmentAgent;
  private final CollaboratorGateway collaboratorGateway;

  @Override
  public String supplement(String topicName, String topicSummary) {
    String text =
        collaboratorGateway.call(
            CollaboratorType.ENRICHER,
            "supplement",
            () -> enrichmentAgent.supplement(topicName, topicSummary == null ? "" : topicSummary));
    if (text == null || text.isBlank()) {
      throw new CollaboratorException(
          CollaboratorType.ENRICHER, "supplement", "empty enrichment", false);
    }
    log.debug("Enrichment for '{}': {} chars", topicName, text.length());
    return text.strip();
  }
}
