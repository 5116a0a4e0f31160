package com.flamingo.ai.smartnotes.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.smartnotes.agent.TopicSegmentationAgent;
import com.flamingo.ai.smartnotes.agent.dto.SegmentationResponse;
import com.flamingo.ai.smartnotes.agent.dto.SegmentationResponse.TopicBlocks;
import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.model.SegmentationHint;
import com.flamingo.ai.smartnotes.domain.model.SegmentationOutcome;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.TopicProposal;
import com.flamingo.ai.smartnotes.exception.ExtractionInsufficientException;
import com.flamingo.ai.smartnotes.exception.SegmentationUpstreamException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SegmenterImpl")
class SegmenterImplTest {

  private static final String CELLS = "Cells are the basic unit of life and contain organelles.";
  private static final String MEMBRANES =
      "Membranes control what enters and leaves the cell interior.";
  private static final String MITOSIS =
      "Mitosis divides one nucleus into two identical daughter nuclei.";
  private static final String CONTENT = CELLS + "\n\n" + MEMBRANES + "\n\n" + MITOSIS;

  private static final SegmentationHint HINT = new SegmentationHint(50, 1, 5, "balanced");

  @Mock private TopicSegmentationAgent segmentationAgent;

  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private SmartNotesConfig config;
  private SegmenterImpl segmenter;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    meterRegistry = new SimpleMeterRegistry();
    config = new SmartNotesConfig();
    config.getCollaborator().setMaxAttempts(1);
    CollaboratorGateway gateway = new CollaboratorGateway(config, executor, meterRegistry);
    segmenter =
        new SegmenterImpl(
            segmentationAgent, new ContentBlockSplitter(), gateway, config, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static SegmentationResponse answer(TopicBlocks... topics) {
    return new SegmentationResponse(List.of(topics));
  }

  private static TopicBlocks topic(String name, Integer... blocks) {
    return new TopicBlocks(name, name + " description", List.of(blocks));
  }

  private void agentAnswers(SegmentationResponse first, SegmentationResponse... rest) {
    when(segmentationAgent.segment(
            anyString(), anyInt(), anyInt(), anyInt(), anyString(), anyString()))
        .thenReturn(first, rest);
  }

  @Test
  @DisplayName("should turn block assignments into spans covering the content")
  void shouldProduceSpans_whenAnswerValid() {
    agentAnswers(answer(topic("Cell basics", 0, 1), topic("Mitosis", 2)));

    SegmentationOutcome outcome = segmenter.segment(CONTENT, HINT);

    int mitosisStart = CONTENT.indexOf(MITOSIS);
    assertThat(outcome.attempts()).isEqualTo(1);
    assertThat(outcome.reduced()).isFalse();
    assertThat(outcome.proposals())
        .extracting(TopicProposal::name)
        .containsExactly("Cell basics", "Mitosis");
    assertThat(outcome.proposals().get(0).spans())
        .containsExactly(new SourceSpan(0, mitosisStart));
    assertThat(outcome.proposals().get(1).spans())
        .containsExactly(new SourceSpan(mitosisStart, CONTENT.length()));
  }

  @Test
  @DisplayName("should give a topic one span per run of non-adjacent blocks")
  void shouldSplitSpans_whenBlocksNotAdjacent() {
    agentAnswers(answer(topic("Cells and division", 0, 2), topic("Membranes", 1)));

    SegmentationOutcome outcome = segmenter.segment(CONTENT, HINT);

    assertThat(outcome.proposals().get(0).spans()).hasSize(2);
    assertThat(outcome.proposals().get(1).spans()).hasSize(1);
  }

  @Test
  @DisplayName("should re-prompt with a correction when blocks overlap")
  void shouldRetryWithCorrection_whenBlocksOverlap() {
    agentAnswers(
        answer(topic("A", 0, 1), topic("B", 1, 2)),
        answer(topic("A", 0), topic("B", 1, 2)));

    SegmentationOutcome outcome = segmenter.segment(CONTENT, HINT);

    assertThat(outcome.attempts()).isEqualTo(2);
    verify(segmentationAgent)
        .segment(
            anyString(),
            anyInt(),
            anyInt(),
            eq(3),
            contains("Blocks assigned more than once: [1]"),
            anyString());
    assertThat(meterRegistry.counter("segmentation.retries").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should fail after the retry budget when every answer overlaps")
  void shouldThrow_whenOverlapPersists() {
    SegmentationResponse overlapping = answer(topic("A", 0, 1), topic("B", 1, 2));
    agentAnswers(overlapping, overlapping, overlapping);

    assertThatThrownBy(() -> segmenter.segment(CONTENT, HINT))
        .isInstanceOfSatisfying(
            SegmentationUpstreamException.class,
            e -> {
              assertThat(e.isRetriable()).isFalse();
              assertThat(e.getMessage()).contains("overlapping blocks [1]");
            });
    verify(segmentationAgent, times(3))
        .segment(anyString(), anyInt(), anyInt(), anyInt(), anyString(), anyString());
  }

  @Test
  @DisplayName("should accept omitted blocks on the final attempt when allowed")
  void shouldAcceptOmissions_whenFinalAttemptOmitsBlocks() {
    SegmentationResponse omitting = answer(topic("A", 0), topic("B", 1));
    agentAnswers(omitting, omitting, omitting);

    SegmentationOutcome outcome = segmenter.segment(CONTENT, HINT);

    assertThat(outcome.attempts()).isEqualTo(3);
    assertThat(outcome.proposals()).hasSize(2);
  }

  @Test
  @DisplayName("should reject omitted blocks when unassigned content is not allowed")
  void shouldThrow_whenOmissionsNotAllowed() {
    config.getSegmentation().setAllowUnassigned(false);
    SegmentationResponse omitting = answer(topic("A", 0), topic("B", 1));
    agentAnswers(omitting, omitting, omitting);

    assertThatThrownBy(() -> segmenter.segment(CONTENT, HINT))
        .isInstanceOf(SegmentationUpstreamException.class)
        .hasMessageContaining("omitted blocks [2]");
  }

  @Test
  @DisplayName("should flag a reduced outcome when fewer topics come back than requested")
  void shouldFlagReduced_whenTooFewTopics() {
    agentAnswers(answer(topic("Everything", 0, 1, 2)));

    SegmentationOutcome outcome =
        segmenter.segment(CONTENT, new SegmentationHint(80, 3, 6, "specific"));

    assertThat(outcome.reduced()).isTrue();
    assertThat(meterRegistry.counter("segmentation.reduced").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report an upstream failure when the model is unavailable")
  void shouldThrowUpstream_whenModelUnavailable() {
    when(segmentationAgent.segment(
            anyString(), anyInt(), anyInt(), anyInt(), anyString(), anyString()))
        .thenThrow(new RuntimeException("HTTP 503 service unavailable"));

    assertThatThrownBy(() -> segmenter.segment(CONTENT, HINT))
        .isInstanceOfSatisfying(
            SegmentationUpstreamException.class, e -> assertThat(e.isRetriable()).isTrue());
  }

  @Test
  @DisplayName("should reject content too short to segment without calling the model")
  void shouldThrowInsufficient_whenContentTooShort() {
    assertThatThrownBy(() -> segmenter.segment("Too short.", HINT))
        .isInstanceOf(ExtractionInsufficientException.class);
    verify(segmentationAgent, never())
        .segment(anyString(), anyInt(), anyInt(), anyInt(), anyString(), anyString());
  }

  @Test
  @DisplayName("should coalesce blocks so the prompt stays within the input budget")
  void shouldCoalesceBlocks_whenTooManyParagraphs() {
    String content =
        IntStream.range(0, 2000)
            .mapToObj(i -> "Paragraph " + i + " explains one small detail of cell biology.")
            .collect(Collectors.joining("\n\n"));
    when(segmentationAgent.segment(
            anyString(), anyInt(), anyInt(), anyInt(), anyString(), anyString()))
        .thenAnswer(
            invocation -> {
              int blockCount = invocation.getArgument(3);
              List<Integer> all = IntStream.range(0, blockCount).boxed().toList();
              return new SegmentationResponse(List.of(new TopicBlocks("Cells", "", all)));
            });

    SegmentationOutcome outcome = segmenter.segment(content, HINT);

    ArgumentCaptor<Integer> blockCount = ArgumentCaptor.forClass(Integer.class);
    ArgumentCaptor<String> numbered = ArgumentCaptor.forClass(String.class);
    verify(segmentationAgent)
        .segment(
            anyString(),
            anyInt(),
            anyInt(),
            blockCount.capture(),
            anyString(),
            numbered.capture());
    int maxInputChars = config.getSegmentation().getMaxInputChars();
    assertThat(numbered.getValue().length()).isLessThanOrEqualTo(maxInputChars);
    assertThat(blockCount.getValue()).isLessThan(2000);
    assertThat(outcome.proposals().get(0).spans())
        .containsExactly(new SourceSpan(0, content.length()));
  }
}
