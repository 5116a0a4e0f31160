package com.flamingo.ai.smartnotes.service.segmentation;

import com.flamingo.ai.smartnotes.agent.TopicSegmentationAgent;
import com.flamingo.ai.smartnotes.agent.dto.SegmentationResponse;
import com.flamingo.ai.smartnotes.agent.dto.SegmentationResponse.TopicBlocks;
import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.model.SegmentationHint;
import com.flamingo.ai.smartnotes.domain.model.SegmentationOutcome;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.TopicProposal;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.ExtractionInsufficientException;
import com.flamingo.ai.smartnotes.exception.SegmentationUpstreamException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link Segmenter} backed by {@link TopicSegmentationAgent}.
 *
 * <p>The content is split into numbered blocks and the model assigns block indices to topics.
 * Each answer is validated: every index must be in range and claimed by at most one topic, every
 * topic needs a name and at least one block. An invalid answer triggers a corrective re-prompt
 * that restates the partition rule, up to {@code segmentation.max-retries} times. Blocks left out
 * of the final answer become unassigned content when {@code segmentation.allow-unassigned} is set.
 *
 * <p>The numbered blocks never exceed {@code segmentation.max-input-chars}: when there are too many
 * blocks to preview each one, adjacent blocks are coalesced first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmenterImpl implements Segmenter {

  /** Each block is previewed with at least this many characters in the prompt. */
  private static final int MIN_BLOCK_PREVIEW_CHARS = 200;

  /** Room for the index label, the ellipsis and the separator around each preview. */
  private static final int BLOCK_OVERHEAD_CHARS = 24;

  private final TopicSegmentationAgent segmentationAgent;
  private final ContentBlockSplitter blockSplitter;
  private final CollaboratorGateway collaboratorGateway;
  private final SmartNotesConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "segmentation.duration", description = "Time to segment a document")
  public SegmentationOutcome segment(String content, SegmentationHint hint) {
    SmartNotesConfig.Segmentation settings = config.getSegmentation();
    int meaningful = content == null ? 0 : content.strip().length();
    if (meaningful < settings.getMinContentChars()) {
      throw new ExtractionInsufficientException(meaningful, settings.getMinContentChars());
    }

    List<ContentBlock> blocks =
        coalesce(blockSplitter.split(content), content, settings.getMaxInputChars());
    int maxTopics = Math.min(hint.maxTopics(), blocks.size());
    int minTopics = Math.min(hint.minTopics(), maxTopics);
    String numberedBlocks = numberBlocks(blocks, settings.getMaxInputChars());
    int maxAttempts = 1 + Math.max(0, settings.getMaxRetries());

    String correction = "";
    Validation last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      String currentCorrection = correction;
      SegmentationResponse response;
      try {
        response =
            collaboratorGateway.call(
                CollaboratorType.LANGUAGE_MODEL,
                "segment",
                () ->
                    segmentationAgent.segment(
                        hint.guidance(),
                        minTopics,
                        maxTopics,
                        blocks.size(),
                        currentCorrection,
                        numberedBlocks));
      } catch (CollaboratorException e) {
        throw new SegmentationUpstreamException(
            "language model unavailable: " + e.getMessage(), e.isRetriable(), e);
      }

      last = validate(response, blocks.size());
      if (last.isValid()) {
        return outcome(last, blocks, hint, attempt);
      }

      boolean finalAttempt = attempt == maxAttempts;
      if (finalAttempt && last.onlyOmissions() && settings.isAllowUnassigned()) {
        log.warn(
            "Accepting segmentation with {} unassigned blocks after {} attempts",
            last.missing.size(),
            attempt);
        return outcome(last, blocks, hint, attempt);
      }
      if (!finalAttempt) {
        meterRegistry.counter("segmentation.retries").increment();
        log.warn("Segmentation attempt {} rejected: {}", attempt, last.describe());
        correction = correctionFor(last, blocks.size());
      }
    }

    throw new SegmentationUpstreamException(
        "invalid segmentation after " + maxAttempts + " attempts: " + last.describe(),
        false,
        null);
  }

  // ---- prompt construction ----

  /** Merges runs of adjacent blocks until every block gets at least the minimum preview. */
  private List<ContentBlock> coalesce(
      List<ContentBlock> blocks, String content, int maxInputChars) {
    int maxBlocks = Math.max(1, maxInputChars / (MIN_BLOCK_PREVIEW_CHARS + BLOCK_OVERHEAD_CHARS));
    if (blocks.size() <= maxBlocks) {
      return blocks;
    }
    int groupSize = (blocks.size() + maxBlocks - 1) / maxBlocks;
    List<ContentBlock> merged = new ArrayList<>();
    for (int from = 0; from < blocks.size(); from += groupSize) {
      ContentBlock first = blocks.get(from);
      ContentBlock last = blocks.get(Math.min(from + groupSize, blocks.size()) - 1);
      merged.add(
          new ContentBlock(
              merged.size(),
              first.start(),
              last.end(),
              content.substring(first.start(), last.end())));
    }
    log.info(
        "Coalesced {} blocks into {} to fit {} prompt characters",
        blocks.size(),
        merged.size(),
        maxInputChars);
    return merged;
  }

  private String numberBlocks(List<ContentBlock> blocks, int maxInputChars) {
    int perBlock =
        Math.max(
            MIN_BLOCK_PREVIEW_CHARS,
            maxInputChars / Math.max(1, blocks.size()) - BLOCK_OVERHEAD_CHARS);
    StringBuilder sb = new StringBuilder();
    for (ContentBlock block : blocks) {
      String text = block.text().strip();
      if (text.length() > perBlock) {
        text = text.substring(0, perBlock) + " ...";
      }
      sb.append('[').append(block.index()).append("] ").append(text).append("\n\n");
    }
    return sb.toString().trim();
  }

  private String correctionFor(Validation validation, int blockCount) {
    StringBuilder sb = new StringBuilder();
    sb.append("Your previous answer was invalid. Every block index from 0 to ")
        .append(blockCount - 1)
        .append(" must belong to exactly one topic: no block may appear in two topics and no")
        .append(" block may be left out.");
    if (!validation.duplicated.isEmpty()) {
      sb.append(" Blocks assigned more than once: ").append(validation.duplicated).append('.');
    }
    if (!validation.missing.isEmpty()) {
      sb.append(" Blocks not assigned: ").append(validation.missing).append('.');
    }
    if (!validation.outOfRange.isEmpty()) {
      sb.append(" Indices that do not exist: ").append(validation.outOfRange).append('.');
    }
    if (validation.malformed != null) {
      sb.append(' ').append(validation.malformed);
    }
    return sb.toString();
  }

  // ---- validation ----

  private Validation validate(SegmentationResponse response, int blockCount) {
    Validation validation = new Validation();
    if (response == null || response.topics() == null || response.topics().isEmpty()) {
      validation.malformed = "The answer must contain a non-empty \"topics\" array.";
      return validation;
    }

    Map<Integer, Integer> owner = new TreeMap<>();
    for (int t = 0; t < response.topics().size(); t++) {
      TopicBlocks topic = response.topics().get(t);
      if (topic == null || topic.name() == null || topic.name().isBlank()) {
        validation.malformed = "Every topic needs a non-empty \"name\".";
        continue;
      }
      if (topic.blocks() == null || topic.blocks().isEmpty()) {
        validation.malformed = "Every topic needs at least one block index.";
        continue;
      }
      for (Integer index : topic.blocks()) {
        if (index == null || index < 0 || index >= blockCount) {
          validation.outOfRange.add(index == null ? -1 : index);
          continue;
        }
        Integer previous = owner.putIfAbsent(index, t);
        if (previous != null && previous != t) {
          validation.duplicated.add(index);
        }
      }
    }
    for (int i = 0; i < blockCount; i++) {
      if (!owner.containsKey(i)) {
        validation.missing.add(i);
      }
    }
    validation.topics = response.topics();
    return validation;
  }

  private SegmentationOutcome outcome(
      Validation validation, List<ContentBlock> blocks, SegmentationHint hint, int attempts) {
    List<TopicProposal> proposals = new ArrayList<>();
    for (TopicBlocks topic : validation.topics) {
      TreeSet<Integer> indices = new TreeSet<>(topic.blocks());
      proposals.add(
          new TopicProposal(
              topic.name().strip(),
              topic.description() == null ? "" : topic.description().strip(),
              toSpans(indices, blocks)));
    }
    proposals.sort(
        (a, b) -> SourceSpan.BY_POSITION.compare(a.spans().get(0), b.spans().get(0)));

    boolean reduced = proposals.size() < hint.minTopics();
    if (reduced) {
      meterRegistry.counter("segmentation.reduced").increment();
      log.warn(
          "Segmentation reduced: {} topics for a hint of {}-{} over {} blocks",
          proposals.size(),
          hint.minTopics(),
          hint.maxTopics(),
          blocks.size());
    }
    log.debug("Segmentation produced {} topics in {} attempts", proposals.size(), attempts);
    return new SegmentationOutcome(proposals, reduced, attempts);
  }

  /** Runs of consecutive block indices become one span each. */
  private static List<SourceSpan> toSpans(TreeSet<Integer> indices, List<ContentBlock> blocks) {
    List<SourceSpan> spans = new ArrayList<>();
    Integer runStart = null;
    Integer previous = null;
    for (Integer index : indices) {
      if (runStart == null) {
        runStart = index;
      } else if (index != previous + 1) {
        spans.add(new SourceSpan(blocks.get(runStart).start(), blocks.get(previous).end()));
        runStart = index;
      }
      previous = index;
    }
    if (runStart != null) {
      spans.add(new SourceSpan(blocks.get(runStart).start(), blocks.get(previous).end()));
    }
    return spans;
  }

  /** Problems found in one model answer. */
  private static final class Validation {
    private final TreeSet<Integer> duplicated = new TreeSet<>();
    private final TreeSet<Integer> missing = new TreeSet<>();
    private final TreeSet<Integer> outOfRange = new TreeSet<>();
    private String malformed;
    private List<TopicBlocks> topics = List.of();

    boolean isValid() {
      return malformed == null && duplicated.isEmpty() && missing.isEmpty() && outOfRange.isEmpty();
    }

    boolean onlyOmissions() {
      return malformed == null && duplicated.isEmpty() && outOfRange.isEmpty()
          && !missing.isEmpty();
    }

    String describe() {
      List<String> problems = new ArrayList<>();
      if (malformed != null) {
        problems.add(malformed);
      }
      if (!duplicated.isEmpty()) {
        problems.add("overlapping blocks " + duplicated);
      }
      if (!missing.isEmpty()) {
        problems.add("omitted blocks " + missing);
      }
      if (!outOfRange.isEmpty()) {
        problems.add("unknown blocks " + outOfRange);
      }
      return String.join("; ", problems);
    }
  }
}
