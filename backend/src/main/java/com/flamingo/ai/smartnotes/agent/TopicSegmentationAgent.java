package com.flamingo.ai.smartnotes.agent;

import com.flamingo.ai.smartnotes.agent.dto.SegmentationResponse;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that groups a document's numbered content blocks into topics.
 *
 * <p>The agent answers with block indices rather than character offsets, so the caller can map
 * its answer onto exact, non-overlapping spans.
 */
public interface TopicSegmentationAgent {

  @SystemMessage(
      """
        You are an expert educator who organises study material into topics for note taking.
        You receive a document split into numbered blocks. Group the blocks into coherent topics.

        Rules:
        - Every block index from 0 to blockCount-1 belongs to exactly one topic.
        - A block is never assigned to two topics and never left out.
        - Prefer contiguous blocks for a topic, but a topic may own blocks that are not adjacent
          when the material returns to the same subject.
        - Give each topic a short, specific name (at most 8 words) and a one or two sentence
          description of what it covers.
        - Order topics by the first block they own.

        Return ONLY valid JSON matching this structure:
        {"topics": [{"name": "...", "description": "...", "blocks": [0, 1, 2]}]}
        """)
  @UserMessage(
      """
        Topic breadth: {{guidance}}
        Produce between {{minTopics}} and {{maxTopics}} topics (fewer if the material does not
        support that many distinct topics).
        Block count: {{blockCount}}
        {{correction}}

        Blocks:
        {{blocks}}
        """)
  SegmentationResponse segment(
      @V("guidance") String guidance,
      @V("minTopics") int minTopics,
      @V("maxTopics") int maxTopics,
      @V("blockCount") int blockCount,
      @V("correction") String correction,
      @V("blocks") String blocks);
}
