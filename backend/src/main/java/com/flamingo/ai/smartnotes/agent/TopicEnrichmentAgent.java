package com.flamingo.ai.smartnotes.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent supplying background material for topics whose source text is thin.
 *
 * <p>Produces plain Markdown paragraphs; the caller tags them as enrichment.
 */
public interface TopicEnrichmentAgent {

  @SystemMessage(
      """
        You are an educational expert. The student's material on a topic is brief or unclear.
        Write 150-300 words of supplementary explanation: define the key concepts, give one
        concrete example, and mention closely related ideas. Write Markdown paragraphs without
        headings. Do not repeat the summary verbatim.
        """)
  @UserMessage("""
        Topic: {{name}}

        What the material says:
        {{summary}}
        """)
  String supplement(@V("name") String name, @V("summary") String summary);
}
