package com.flamingo.ai.smartnotes.service.graph;

import com.flamingo.ai.smartnotes.domain.model.HyperlinkEdge;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicGraphState;
import com.flamingo.ai.smartnotes.domain.model.TopicProposal;
import com.flamingo.ai.smartnotes.exception.InvariantViolationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative topic structure of one document.
 *
 * <p>Invariants:
 *
 * <ul>
 *   <li>spans owned by distinct live topics never overlap, and every span lies inside the content;
 *   <li>topic keys are unique and never reused, absorbed keys live on in a tombstone map pointing
 *       at the absorbing topic;
 *   <li>edges connect live topics only, without self-loops or duplicates.
 * </ul>
 *
 * <p>{@link #apply} and {@link #recordMerge} validate fully before touching any state, so a failed
 * call leaves the graph as it was. Instances are not thread-safe; callers hold the document lock.
 */
@Slf4j
public class TopicGraph {

  private static final String KEY_PREFIX = "T";

  private final int contentLength;
  private final LinkedHashMap<String, Topic> topics = new LinkedHashMap<>();
  private final LinkedHashMap<String, String> tombstones = new LinkedHashMap<>();
  private final List<HyperlinkEdge> edges = new ArrayList<>();
  private List<SourceSpan> unassigned = List.of();
  private long nextKeySequence = 1;

  public TopicGraph(int contentLength) {
    if (contentLength < 0) {
      throw new IllegalArgumentException("contentLength must be >= 0");
    }
    this.contentLength = contentLength;
  }

  /** Rebuilds a graph from persisted state, re-checking its invariants. */
  public static TopicGraph restore(TopicGraphState state) {
    TopicGraph graph = new TopicGraph(state.contentLength());
    for (Topic topic : state.topics()) {
      graph.topics.put(topic.key(), topic);
    }
    graph.tombstones.putAll(state.tombstones());
    graph.edges.addAll(state.edges());
    graph.unassigned = List.copyOf(state.unassigned());
    graph.nextKeySequence = state.nextKeySequence();
    graph.checkSpans(graph.topics.values());
    return graph;
  }

  public TopicGraphState toState() {
    return new TopicGraphState(
        contentLength,
        List.copyOf(topics.values()),
        Map.copyOf(tombstones),
        List.copyOf(edges),
        unassigned,
        nextKeySequence);
  }

  // ---- mutations ----

  /**
   * Replaces the topic set with freshly keyed topics built from the proposals. Edges are cleared
   * and previous topics are dropped without tombstones.
   *
   * @param proposals topics to install, with disjoint in-bounds spans
   * @param allowUnassigned whether content outside every span is accepted as unassigned
   * @return the installed topics in order
   * @throws InvariantViolationException if spans overlap, fall outside the content, or leave gaps
   *     that are not allowed
   */
  public List<Topic> apply(List<TopicProposal> proposals, boolean allowUnassigned) {
    if (proposals == null || proposals.isEmpty()) {
      throw new InvariantViolationException("Cannot apply an empty topic set");
    }
    List<Topic> candidates = new ArrayList<>(proposals.size());
    long sequence = nextKeySequence;
    for (TopicProposal proposal : proposals) {
      if (proposal.name() == null || proposal.name().isBlank()) {
        throw new InvariantViolationException("Topic proposal without a name");
      }
      candidates.add(
          new Topic(
              KEY_PREFIX + sequence++,
              proposal.name(),
              proposal.description(),
              proposal.spans(),
              1));
    }
    checkSpans(candidates);
    List<SourceSpan> gaps = gaps(candidates);
    if (!gaps.isEmpty() && !allowUnassigned) {
      throw new InvariantViolationException("Topics leave content uncovered: " + gaps);
    }

    topics.clear();
    tombstones.clear();
    edges.clear();
    candidates.forEach(topic -> topics.put(topic.key(), topic));
    unassigned = gaps;
    nextKeySequence = sequence;
    log.debug(
        "Applied {} topics ({} unassigned ranges) over {} chars",
        topics.size(),
        gaps.size(),
        contentLength);
    return list();
  }

  /** Reserves a fresh key; keys are never handed out twice. */
  public String allocateKey() {
    return KEY_PREFIX + nextKeySequence++;
  }

  /**
   * Installs a merged topic in place of the absorbed ones. The result takes the position of the
   * first absorbed topic and a version above every absorbed version. Absorbed keys become
   * tombstones and edges are rewritten through them.
   *
   * @return the stored result topic
   * @throws InvariantViolationException if the absorbed keys are not live, the result key is not
   *     fresh, or the result's spans differ from the union of the absorbed spans
   */
  public Topic recordMerge(Topic result, Collection<String> absorbedKeys) {
    Set<String> absorbed = new LinkedHashSet<>(absorbedKeys);
    if (absorbed.size() < 2) {
      throw new InvariantViolationException("A merge needs at least two absorbed topics");
    }
    for (String key : absorbed) {
      if (!topics.containsKey(key)) {
        throw new InvariantViolationException("Absorbed topic is not live: " + key);
      }
    }
    if (topics.containsKey(result.key()) || tombstones.containsKey(result.key())) {
      throw new InvariantViolationException("Merge result reuses key " + result.key());
    }
    List<SourceSpan> union =
        absorbed.stream()
            .flatMap(key -> topics.get(key).spans().stream())
            .sorted(SourceSpan.BY_POSITION)
            .toList();
    if (!union.equals(result.spans())) {
      throw new InvariantViolationException(
          "Merge result spans " + result.spans() + " differ from absorbed spans " + union);
    }

    long version =
        Math.max(
                result.version(),
                absorbed.stream().mapToLong(key -> topics.get(key).version()).max().orElse(0))
            + 1;
    Topic stored = result.withVersion(version);

    LinkedHashMap<String, Topic> reordered = new LinkedHashMap<>();
    boolean inserted = false;
    for (Map.Entry<String, Topic> entry : topics.entrySet()) {
      if (absorbed.contains(entry.getKey())) {
        if (!inserted) {
          reordered.put(stored.key(), stored);
          inserted = true;
        }
      } else {
        reordered.put(entry.getKey(), entry.getValue());
      }
    }
    checkSpans(reordered.values());

    topics.clear();
    topics.putAll(reordered);
    tombstones.replaceAll((key, target) -> absorbed.contains(target) ? stored.key() : target);
    absorbed.forEach(key -> tombstones.put(key, stored.key()));
    rewriteEdges();
    log.debug("Recorded merge of {} into {} (v{})", absorbed, stored.key(), version);
    return stored;
  }

  /**
   * Renames a live topic and the anchor text of edges pointing at it. Names do not affect span
   * ownership, so the version is unchanged.
   */
  public Topic rename(String key, String name) {
    Topic topic = topics.get(key);
    if (topic == null) {
      throw new InvariantViolationException("Cannot rename unknown topic " + key);
    }
    if (name == null || name.isBlank()) {
      throw new InvariantViolationException("Cannot give topic " + key + " a blank name");
    }
    Topic renamed = topic.withName(name.strip());
    topics.put(key, renamed);
    edges.replaceAll(
        edge ->
            edge.targetKey().equals(key)
                ? new HyperlinkEdge(edge.sourceKey(), key, renamed.name())
                : edge);
    return renamed;
  }

  /**
   * Replaces every edge leaving {@code sourceKey}. Duplicate targets keep their first anchor.
   *
   * @throws InvariantViolationException on a self-loop, a foreign source or a non-live target
   */
  public void replaceOutgoingEdges(String sourceKey, List<HyperlinkEdge> outgoing) {
    if (!topics.containsKey(sourceKey)) {
      throw new InvariantViolationException("Edges from unknown topic " + sourceKey);
    }
    List<HyperlinkEdge> accepted = new ArrayList<>();
    Set<String> targets = new HashSet<>();
    for (HyperlinkEdge edge : outgoing) {
      if (!sourceKey.equals(edge.sourceKey())) {
        throw new InvariantViolationException(
            "Edge " + edge + " does not start at " + sourceKey);
      }
      if (sourceKey.equals(edge.targetKey())) {
        throw new InvariantViolationException("Self-loop on " + sourceKey);
      }
      if (!topics.containsKey(edge.targetKey())) {
        throw new InvariantViolationException("Edge targets non-live topic " + edge.targetKey());
      }
      if (targets.add(edge.targetKey())) {
        accepted.add(edge);
      }
    }
    edges.removeIf(edge -> edge.sourceKey().equals(sourceKey));
    edges.addAll(accepted);
  }

  // ---- reads ----

  public Optional<Topic> get(String key) {
    return Optional.ofNullable(topics.get(key));
  }

  /** Live topics in stable insertion order. */
  public List<Topic> list() {
    return List.copyOf(topics.values());
  }

  public boolean isLive(String key) {
    return topics.containsKey(key);
  }

  public boolean isTombstoned(String key) {
    return tombstones.containsKey(key);
  }

  /** Follows tombstones from any key ever issued to the live topic that now owns its content. */
  public Optional<String> resolve(String key) {
    String current = key;
    Set<String> seen = new HashSet<>();
    while (current != null && !topics.containsKey(current)) {
      if (!seen.add(current)) {
        throw new InvariantViolationException("Tombstone cycle through " + current);
      }
      current = tombstones.get(current);
    }
    return Optional.ofNullable(current);
  }

  public List<HyperlinkEdge> edges() {
    return List.copyOf(edges);
  }

  public List<HyperlinkEdge> outgoing(String key) {
    return edges.stream().filter(edge -> edge.sourceKey().equals(key)).toList();
  }

  public List<SourceSpan> unassigned() {
    return unassigned;
  }

  public int contentLength() {
    return contentLength;
  }

  public int size() {
    return topics.size();
  }

  // ---- invariant helpers ----

  private void checkSpans(Collection<Topic> candidates) {
    List<OwnedSpan> owned = new ArrayList<>();
    for (Topic topic : candidates) {
      if (topic.spans().isEmpty()) {
        throw new InvariantViolationException("Topic " + topic.key() + " owns no content");
      }
      for (SourceSpan span : topic.spans()) {
        if (span.start() < 0 || span.end() > contentLength || span.start() >= span.end()) {
          throw new InvariantViolationException(
              "Topic " + topic.key() + " has invalid span " + span + " for " + contentLength
                  + " chars");
        }
        owned.add(new OwnedSpan(topic.key(), span));
      }
    }
    owned.sort((a, b) -> SourceSpan.BY_POSITION.compare(a.span(), b.span()));
    for (int i = 1; i < owned.size(); i++) {
      OwnedSpan previous = owned.get(i - 1);
      OwnedSpan current = owned.get(i);
      if (previous.span().overlaps(current.span())) {
        throw new InvariantViolationException(
            "Span "
                + previous.span()
                + " of "
                + previous.topicKey()
                + " overlaps span "
                + current.span()
                + " of "
                + current.topicKey());
      }
    }
  }

  private List<SourceSpan> gaps(Collection<Topic> candidates) {
    List<SourceSpan> sorted =
        candidates.stream()
            .flatMap(topic -> topic.spans().stream())
            .sorted(SourceSpan.BY_POSITION)
            .toList();
    List<SourceSpan> gaps = new ArrayList<>();
    int cursor = 0;
    for (SourceSpan span : sorted) {
      if (span.start() > cursor) {
        gaps.add(new SourceSpan(cursor, span.start()));
      }
      cursor = Math.max(cursor, span.end());
    }
    if (cursor < contentLength) {
      gaps.add(new SourceSpan(cursor, contentLength));
    }
    return List.copyOf(gaps);
  }

  /** Points every edge at live topics, dropping self-loops and duplicates. */
  private void rewriteEdges() {
    List<HyperlinkEdge> rewritten = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (HyperlinkEdge edge : edges) {
      Optional<String> source = resolve(edge.sourceKey());
      Optional<String> target = resolve(edge.targetKey());
      if (source.isEmpty() || target.isEmpty() || source.get().equals(target.get())) {
        continue;
      }
      if (!seen.add(source.get() + "->" + target.get())) {
        continue;
      }
      String anchor =
          target.get().equals(edge.targetKey())
              ? edge.anchorText()
              : topics.get(target.get()).name();
      rewritten.add(new HyperlinkEdge(source.get(), target.get(), anchor));
    }
    edges.clear();
    edges.addAll(rewritten);
  }

  private record OwnedSpan(String topicKey, SourceSpan span) {}
}
