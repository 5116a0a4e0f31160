package com.flamingo.ai.smartnotes.agent.dto;

import java.util.List;

/** Structured output from TopicSegmentationAgent. */
public record SegmentationResponse(List<TopicBlocks> topics) {

  /** One proposed topic and the block indices it owns. */
  public record TopicBlocks(String name, String description, List<Integer> blocks) {}
}
