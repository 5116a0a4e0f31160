package com.flamingo.ai.smartnotes.agent;

import com.flamingo.ai.smartnotes.agent.dto.MergeNameResponse;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that names a topic formed by merging several topics. */
public interface TopicMergeNamingAgent {

  @SystemMessage(
      """
        You name study topics. Several topics are being combined into one. Produce a concise,
        descriptive name (at most 8 words) that covers all of them, and a one or two sentence
        description of the combined topic.

        Return ONLY valid JSON matching this structure:
        {"name": "...", "description": "..."}
        """)
  @UserMessage("""
        Topics being combined:
        {{topics}}
        """)
  MergeNameResponse name(@V("topics") String topics);
}
