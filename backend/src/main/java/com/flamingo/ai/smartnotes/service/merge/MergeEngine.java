package com.flamingo.ai.smartnotes.service.merge;

import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.service.graph.TopicGraph;
import java.util.Collection;

/** Combines several live topics of a graph into one new topic. */
public interface MergeEngine {

  /**
   * Merges topics into a freshly keyed topic owning the union of their spans.
   *
   * @param graph the document's working graph, mutated on success only
   * @param topicKeys at least two distinct live keys
   * @return the new topic as stored in the graph
   * @throws com.flamingo.ai.smartnotes.exception.MergeTargetInvalidException if fewer than two
   *     distinct keys are given or any key is not live
   */
  Topic merge(TopicGraph graph, Collection<String> topicKeys);
}
