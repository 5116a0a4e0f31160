package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Serializable state of a topic graph.
 *
 * @param contentLength length of the content the spans refer to
 * @param topics live topics in insertion order
 * @param tombstones absorbed key to absorbing key
 * @param edges hyperlink edges between live topics
 * @param unassigned content not owned by any topic
 * @param nextKeySequence next numeric suffix for a fresh key
 */
public record TopicGraphState(
    int contentLength,
    List<Topic> topics,
    Map<String, String> tombstones,
    List<HyperlinkEdge> edges,
    List<SourceSpan> unassigned,
    long nextKeySequence) {

  public static TopicGraphState empty(int contentLength) {
    return new TopicGraphState(contentLength, List.of(), Map.of(), List.of(), List.of(), 1);
  }
}
