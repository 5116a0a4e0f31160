package com.flamingo.ai.smartnotes.service.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.smartnotes.agent.NoteDraftAgent;
import com.flamingo.ai.smartnotes.agent.dto.NoteDraftResponse;
import com.flamingo.ai.smartnotes.agent.dto.NoteDraftResponse.DraftSection;
import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.enums.ContentProvenance;
import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteSection;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.SynthesisOptions;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicProposal;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.SynthesisFailedException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;
import com.flamingo.ai.smartnotes.service.enrichment.Enricher;
import com.flamingo.ai.smartnotes.service.image.ImageAnalyzer;
import com.flamingo.ai.smartnotes.service.render.CommonmarkNoteRenderer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NoteSynthesizerImpl")
class NoteSynthesizerImplTest {

  private static final String LONG_TEXT =
      "Membranes regulate transport of ions across the cell boundary. ".repeat(8).strip();
  private static final String SHORT_TEXT = "Mitosis divides the nucleus.";
  private static final String CONTENT = LONG_TEXT + "\n\n" + SHORT_TEXT;
  private static final SynthesisOptions MARKDOWN = new SynthesisOptions(NoteFormat.MARKDOWN, false);

  @Mock private NoteDraftAgent draftAgent;
  @Mock private Enricher enricher;
  @Mock private ImageAnalyzer imageAnalyzer;
  @Mock private CollaboratorGateway collaboratorGateway;

  private SimpleMeterRegistry meterRegistry;
  private NoteSynthesizerImpl synthesizer;
  private DocumentWorkspace workspace;
  private Topic transport;
  private Topic mitosis;

  @BeforeEach
  void setUp() {
    SmartNotesConfig config = new SmartNotesConfig();
    meterRegistry = new SimpleMeterRegistry();
    synthesizer =
        new NoteSynthesizerImpl(
            draftAgent,
            enricher,
            imageAnalyzer,
            new CommonmarkNoteRenderer(),
            new HyperlinkScorer(config),
            collaboratorGateway,
            config,
            meterRegistry);

    int split = LONG_TEXT.length() + 2;
    workspace =
        DocumentWorkspace.create(
            UUID.randomUUID(),
            "Biology",
            null,
            CONTENT,
            List.of(new MediaReference("img-1", 10, "image/png", "/tmp/figure-1.png")),
            50,
            Instant.now());
    List<Topic> topics =
        workspace
            .getGraph()
            .apply(
                List.of(
                    new TopicProposal(
                        "Membrane transport",
                        "How membranes move ions",
                        List.of(new SourceSpan(0, split))),
                    new TopicProposal(
                        "Mitosis",
                        "Nuclear division",
                        List.of(new SourceSpan(split, CONTENT.length())))),
                false);
    transport = topics.get(0);
    mitosis = topics.get(1);
  }

  @SuppressWarnings("unchecked")
  private void gatewayRunsCalls() throws Exception {
    when(collaboratorGateway.call(any(CollaboratorType.class), anyString(), any(Callable.class)))
        .thenAnswer(invocation -> ((Callable<Object>) invocation.getArgument(2)).call());
  }

  private void draftReturns(String title, boolean uncertain) {
    when(draftAgent.draft(anyString(), anyString(), anyString()))
        .thenReturn(
            new NoteDraftResponse(
                title,
                "How membranes regulate ion transport.",
                List.of(new DraftSection("Key points", "- Ions cross through channels")),
                uncertain));
  }

  @Test
  @DisplayName("should draft a note bound to the topic's current version")
  void shouldSynthesizeNote_whenDraftSucceeds() throws Exception {
    gatewayRunsCalls();
    draftReturns("Membrane transport", false);

    SynthesizedNote result = synthesizer.synthesize(transport, workspace, MARKDOWN);

    Note note = result.note();
    assertThat(note.topicKey()).isEqualTo("T1");
    assertThat(note.topicVersion()).isEqualTo(1);
    assertThat(note.revision()).isEqualTo(1);
    assertThat(note.partial()).isFalse();
    assertThat(note.body().anchor()).isEqualTo("topic-T1");
    assertThat(note.body().sections())
        .extracting(NoteSection::provenance)
        .containsOnly(ContentProvenance.SOURCE);
    assertThat(note.rendered()).startsWith("# Membrane transport");
    assertThat(result.refinedName()).isEmpty();
    verifyNoInteractions(enricher, imageAnalyzer);
  }

  @Test
  @DisplayName("should adopt a refined title from the draft")
  void shouldRefineName_whenDraftTitleDiffers() throws Exception {
    gatewayRunsCalls();
    draftReturns("Ion transport across membranes", false);

    SynthesizedNote result = synthesizer.synthesize(transport, workspace, MARKDOWN);

    assertThat(result.refinedName()).contains("Ion transport across membranes");
    assertThat(result.note().body().title()).isEqualTo("Ion transport across membranes");
  }

  @Nested
  @DisplayName("enrichment")
  class Enrichment {

    @Test
    @DisplayName("should supplement thin topics with a labelled section")
    void shouldEnrich_whenTopicIsThin() throws Exception {
      gatewayRunsCalls();
      draftReturns("Mitosis", false);
      when(enricher.supplement(eq("Mitosis"), anyString()))
          .thenReturn("Mitosis has four phases.");

      Note note = synthesizer.synthesize(mitosis, workspace, MARKDOWN).note();

      assertThat(note.body().sections()).hasSize(2);
      NoteSection extra = note.body().sections().get(1);
      assertThat(extra.heading()).isEqualTo(NoteSynthesizerImpl.ENRICHMENT_HEADING);
      assertThat(extra.provenance()).isEqualTo(ContentProvenance.ENRICHMENT);
      assertThat(note.partial()).isFalse();
    }

    @Test
    @DisplayName("should enrich when the model is unsure of a long topic")
    void shouldEnrich_whenDraftUncertain() throws Exception {
      gatewayRunsCalls();
      draftReturns("Membrane transport", true);
      when(enricher.supplement(anyString(), anyString())).thenReturn("More background.");

      Note note = synthesizer.synthesize(transport, workspace, MARKDOWN).note();

      assertThat(note.body().sections())
          .extracting(NoteSection::provenance)
          .contains(ContentProvenance.ENRICHMENT);
    }

    @Test
    @DisplayName("should mark the note partial when enrichment is unavailable")
    void shouldMarkPartial_whenEnrichmentFails() throws Exception {
      gatewayRunsCalls();
      draftReturns("Mitosis", false);
      when(enricher.supplement(anyString(), anyString()))
          .thenThrow(
              new CollaboratorException(CollaboratorType.ENRICHER, "supplement", "down", true));

      Note note = synthesizer.synthesize(mitosis, workspace, MARKDOWN).note();

      assertThat(note.partial()).isTrue();
      assertThat(note.warnings()).singleElement().asString().startsWith("Enrichment unavailable");
      assertThat(note.body().sections()).hasSize(1);
      assertThat(meterRegistry.counter("notes.partial").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("images")
  class Images {

    private final SynthesisOptions withImages = new SynthesisOptions(NoteFormat.MARKDOWN, true);

    @Test
    @DisplayName("should describe images inside the topic's spans")
    void shouldAttachImages_whenProcessingImages() throws Exception {
      gatewayRunsCalls();
      draftReturns("Membrane transport", false);
      when(imageAnalyzer.describe(any(MediaReference.class))).thenReturn("Channel diagram");

      Note note = synthesizer.synthesize(transport, workspace, withImages).note();

      assertThat(note.body().images()).singleElement()
          .satisfies(image -> assertThat(image.description()).isEqualTo("Channel diagram"));
      assertThat(note.rendered()).contains("## Figures");
    }

    @Test
    @DisplayName("should skip images outside the topic")
    void shouldIgnoreImages_whenOutsideTopic() throws Exception {
      gatewayRunsCalls();
      draftReturns("Mitosis", false);
      when(enricher.supplement(anyString(), anyString())).thenReturn("Background.");

      Note note = synthesizer.synthesize(mitosis, workspace, withImages).note();

      assertThat(note.body().images()).isEmpty();
      verify(imageAnalyzer, never()).describe(any());
    }

    @Test
    @DisplayName("should mark the note partial when an image cannot be analysed")
    void shouldMarkPartial_whenImageAnalysisFails() throws Exception {
      gatewayRunsCalls();
      draftReturns("Membrane transport", false);
      when(imageAnalyzer.describe(any(MediaReference.class)))
          .thenThrow(
              new CollaboratorException(
                  CollaboratorType.IMAGE_ANALYZER, "describe", "unsupported", false));

      Note note = synthesizer.synthesize(transport, workspace, withImages).note();

      assertThat(note.partial()).isTrue();
      assertThat(note.warnings()).singleElement().asString().contains("img-1");
      assertThat(note.body().images()).isEmpty();
    }
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    @DisplayName("should fail when the model returns an empty draft")
    void shouldThrow_whenDraftEmpty() throws Exception {
      gatewayRunsCalls();
      when(draftAgent.draft(anyString(), anyString(), anyString()))
          .thenReturn(new NoteDraftResponse("Title", " ", List.of(), false));

      assertThatThrownBy(() -> synthesizer.synthesize(transport, workspace, MARKDOWN))
          .isInstanceOfSatisfying(
              SynthesisFailedException.class,
              e -> assertThat(e.getTopicKey()).isEqualTo("T1"));
    }

    @Test
    @DisplayName("should keep the retriable flag of a failed draft call")
    void shouldThrowRetriable_whenModelUnavailable() {
      when(collaboratorGateway.call(eq(CollaboratorType.LANGUAGE_MODEL), eq("summarize"), any()))
          .thenThrow(
              new CollaboratorException(
                  CollaboratorType.LANGUAGE_MODEL, "summarize", "rate limited", true));

      assertThatThrownBy(() -> synthesizer.synthesize(transport, workspace, MARKDOWN))
          .isInstanceOfSatisfying(
              SynthesisFailedException.class, e -> assertThat(e.isRetriable()).isTrue());
      verifyNoInteractions(enricher);
    }
  }
}
