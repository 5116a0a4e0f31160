package com.flamingo.ai.smartnotes.agent;

import com.flamingo.ai.smartnotes.agent.dto.NoteDraftResponse;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent drafting a study note for one topic from its source text.
 *
 * <p>Besides the note content the agent reports whether the source material was too thin or
 * unclear to explain the topic well; the caller uses that to decide on enrichment.
 */
public interface NoteDraftAgent {

  @SystemMessage(
      """
        You are an educational expert writing clear, well-structured study notes. Using only the
        source text provided, write a note for the given topic:
        - "title": a precise title for the topic (at most 8 words)
        - "summary": two or three sentences introducing the topic
        - "sections": 2 to 6 sections, each with a "heading" and a Markdown "body" containing
          clear explanations, key terms and examples from the source
        - "uncertain": true if the source text is too short, fragmentary or unclear to explain
          the topic properly, otherwise false

        Return ONLY valid JSON matching this structure:
        {"title": "...", "summary": "...", "sections": [{"heading": "...", "body": "..."}],
         "uncertain": false}
        """)
  @UserMessage(
      """
        Topic: {{name}}
        Description: {{description}}

        Source text:
        {{source}}
        """)
  NoteDraftResponse draft(
      @V("name") String name, @V("description") String description, @V("source") String source);
}
