package com.flamingo.ai.smartnotes.service.merge;

import com.flamingo.ai.smartnotes.agent.TopicMergeNamingAgent;
import com.flamingo.ai.smartnotes.agent.dto.MergeNameResponse;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.MergeTargetInvalidException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import com.flamingo.ai.smartnotes.service.graph.TopicGraph;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link MergeEngine} that names merged topics with {@link TopicMergeNamingAgent}.
 *
 * <p>Absorbed topics keep their notes in history; those notes become stale because their topic
 * is no longer live. If naming fails the original names are joined instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MergeEngineImpl implements MergeEngine {

  static final int MAX_NAME_LENGTH = 120;
  private static final String NAME_SEPARATOR = " & ";

  private final TopicMergeNamingAgent namingAgent;
  private final CollaboratorGateway collaboratorGateway;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "merge.duration", description = "Time to merge topics")
  public Topic merge(TopicGraph graph, Collection<String> topicKeys) {
    List<Topic> absorbed = validate(graph, topicKeys);

    List<SourceSpan> spans =
        absorbed.stream()
            .flatMap(topic -> topic.spans().stream())
            .sorted(SourceSpan.BY_POSITION)
            .toList();
    MergeNameResponse naming = name(absorbed);

    Topic result =
        new Topic(graph.allocateKey(), naming.name(), naming.description(), spans, 0);
    Topic stored =
        graph.recordMerge(result, absorbed.stream().map(Topic::key).toList());

    meterRegistry.counter("merge.completed").increment();
    log.info(
        "Merged {} into {} '{}'",
        absorbed.stream().map(Topic::key).toList(),
        stored.key(),
        stored.name());
    return stored;
  }

  /** Returns the absorbed topics in graph order. */
  private List<Topic> validate(TopicGraph graph, Collection<String> topicKeys) {
    if (topicKeys == null) {
      throw new MergeTargetInvalidException(List.of(), "Select at least two topics to merge.");
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (String key : topicKeys) {
      if (key != null && !key.isBlank()) {
        distinct.add(key.strip());
      }
    }
    if (distinct.size() < 2) {
      throw new MergeTargetInvalidException(topicKeys, "Select at least two topics to merge.");
    }

    List<String> invalid = new ArrayList<>();
    for (String key : distinct) {
      if (!graph.isLive(key)) {
        invalid.add(
            graph.isTombstoned(key)
                ? key + " (already merged into " + graph.resolve(key).orElse("?") + ")"
                : key);
      }
    }
    if (!invalid.isEmpty()) {
      throw new MergeTargetInvalidException(
          topicKeys, "These topics are not part of the document: " + String.join(", ", invalid));
    }

    return graph.list().stream().filter(topic -> distinct.contains(topic.key())).toList();
  }

  private MergeNameResponse name(List<Topic> absorbed) {
    MergeNameResponse fallback = fallbackName(absorbed);
    String listing =
        absorbed.stream()
            .map(topic -> "- " + topic.name() + ": " + topic.description())
            .collect(Collectors.joining("\n"));
    try {
      MergeNameResponse response =
          collaboratorGateway.call(
              CollaboratorType.LANGUAGE_MODEL, "merge-name", () -> namingAgent.name(listing));
      if (response == null
          || response.name() == null
          || response.name().isBlank()
          || response.name().strip().length() > MAX_NAME_LENGTH) {
        log.warn("Merge naming returned an unusable name, using fallback '{}'", fallback.name());
        return fallback;
      }
      String description =
          response.description() == null || response.description().isBlank()
              ? fallback.description()
              : response.description().strip();
      return new MergeNameResponse(response.name().strip(), description);
    } catch (CollaboratorException e) {
      log.warn(
          "Merge naming unavailable, using fallback '{}': {}", fallback.name(), e.getMessage());
      return fallback;
    }
  }

  static MergeNameResponse fallbackName(List<Topic> absorbed) {
    String name = absorbed.stream().map(Topic::name).collect(Collectors.joining(NAME_SEPARATOR));
    String description =
        absorbed.stream()
            .map(Topic::description)
            .filter(Objects::nonNull)
            .filter(text -> !text.isBlank())
            .collect(Collectors.joining(" "));
    return new MergeNameResponse(name, description);
  }
}
