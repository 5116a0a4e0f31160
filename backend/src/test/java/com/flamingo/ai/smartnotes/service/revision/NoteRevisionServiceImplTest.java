package com.flamingo.ai.smartnotes.service.revision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.smartnotes.agent.NoteRevisionAgent;
import com.flamingo.ai.smartnotes.agent.dto.NoteDraftResponse.DraftSection;
import com.flamingo.ai.smartnotes.agent.dto.RevisionResponse;
import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.ChatSender;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.enums.ContentProvenance;
import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;
import com.flamingo.ai.smartnotes.domain.model.NoteSection;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicProposal;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.NoteNotFoundException;
import com.flamingo.ai.smartnotes.exception.StaleTargetException;
import com.flamingo.ai.smartnotes.exception.TopicNotFoundException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;
import com.flamingo.ai.smartnotes.service.render.CommonmarkNoteRenderer;
import com.flamingo.ai.smartnotes.service.render.NoteRenderer;
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
@DisplayName("NoteRevisionServiceImpl")
class NoteRevisionServiceImplTest {

  private static final String CONTENT =
      "Cells contain organelles.\n\nMembranes surround cells.\n\nMitosis splits nuclei.";

  @Mock private NoteRevisionAgent revisionAgent;
  @Mock private CollaboratorGateway collaboratorGateway;

  private SimpleMeterRegistry meterRegistry;
  private NoteRevisionServiceImpl revisionService;
  private DocumentWorkspace workspace;
  private Topic cells;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    revisionService =
        new NoteRevisionServiceImpl(
            revisionAgent,
            new CommonmarkNoteRenderer(),
            collaboratorGateway,
            new SmartNotesConfig(),
            meterRegistry);
    workspace =
        DocumentWorkspace.create(
            UUID.randomUUID(), "Biology", null, CONTENT, List.of(), 50, Instant.now());
    List<Topic> topics =
        workspace
            .getGraph()
            .apply(
                List.of(
                    proposal("Cells", 0, 27),
                    proposal("Membranes", 27, 53),
                    proposal("Mitosis", 53, CONTENT.length())),
                false);
    cells = topics.get(0);
    workspace.addNote(note(cells, 1));
  }

  private static TopicProposal proposal(String name, int start, int end) {
    return new TopicProposal(name, "", List.of(new SourceSpan(start, end)));
  }

  private static Note note(Topic topic, int revision) {
    NoteBody body =
        new NoteBody(
            NoteBody.anchorFor(topic.key()),
            topic.name(),
            "Cells are units of life.",
            List.of(new NoteSection("Key points", "- Organelles", ContentProvenance.SOURCE)),
            List.of(),
            List.of());
    return new Note(
        topic.key(),
        topic.version(),
        revision,
        NoteFormat.MARKDOWN,
        body,
        "# " + topic.name(),
        false,
        List.of(),
        Instant.now());
  }

  @SuppressWarnings("unchecked")
  private void gatewayRunsCalls() throws Exception {
    when(collaboratorGateway.call(any(CollaboratorType.class), anyString(), any(Callable.class)))
        .thenAnswer(invocation -> ((Callable<Object>) invocation.getArgument(2)).call());
  }

  private static RevisionResponse revision(String reply) {
    return new RevisionResponse(
        "Cells are the basic units of life.",
        List.of(new DraftSection("Key points", "- Organelles\n- Nucleus")),
        reply);
  }

  @Test
  @DisplayName("should append a new revision bound to the same topic version")
  void shouldCreateNextRevision_whenInstructionApplied() throws Exception {
    gatewayRunsCalls();
    when(revisionAgent.revise(anyString(), anyString(), eq("Mention the nucleus")))
        .thenReturn(revision("Added the nucleus."));

    Note revised = revisionService.revise(workspace, "T1", "Mention the nucleus", null);

    assertThat(revised.revision()).isEqualTo(2);
    assertThat(revised.topicVersion()).isEqualTo(cells.version());
    assertThat(revised.body().title()).isEqualTo("Cells");
    assertThat(revised.body().sections())
        .extracting(NoteSection::provenance)
        .containsOnly(ContentProvenance.REVISION);
    assertThat(revised.rendered()).contains("- Nucleus");
    assertThat(workspace.noteHistory("T1")).hasSize(2);
    assertThat(workspace.latestNote("T1")).contains(revised);
  }

  @Test
  @DisplayName("should log the instruction and the reply as a pair of turns")
  void shouldAppendTurns_whenRevisionSucceeds() throws Exception {
    gatewayRunsCalls();
    when(revisionAgent.revise(anyString(), anyString(), anyString()))
        .thenReturn(revision(" "));

    revisionService.revise(workspace, "T1", "Shorter please", 1);

    List<ChatTurn> log = workspace.chatLog();
    assertThat(log).hasSize(2);
    assertThat(log.get(0).sender()).isEqualTo(ChatSender.USER);
    assertThat(log.get(0).message()).isEqualTo("Shorter please");
    assertThat(log.get(0).noteRevision()).isEqualTo(1);
    assertThat(log.get(1).sender()).isEqualTo(ChatSender.ASSISTANT);
    assertThat(log.get(1).message()).isEqualTo("The note has been updated.");
    assertThat(log.get(1).noteRevision()).isEqualTo(2);
    assertThat(log.get(1).sequence()).isEqualTo(2);
  }

  @Test
  @DisplayName("should send earlier turns about the same topic as history")
  void shouldIncludeHistory_whenTopicHasPriorTurns() throws Exception {
    gatewayRunsCalls();
    Instant now = Instant.now();
    workspace.appendTurn(ChatSender.USER, "T1", 1, "Use bullet points", false, now);
    workspace.appendTurn(ChatSender.USER, "T2", 1, "Unrelated request", false, now);
    when(revisionAgent.revise(anyString(), anyString(), anyString()))
        .thenReturn(revision("Done."));

    revisionService.revise(workspace, "T1", "Add an example", null);

    verify(revisionAgent)
        .revise(contains("user: Use bullet points"), contains("# Cells"), eq("Add an example"));
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    @DisplayName("should record an error turn and keep the note when the model fails")
    void shouldRecordErrorTurn_whenModelFails() {
      when(collaboratorGateway.call(eq(CollaboratorType.LANGUAGE_MODEL), eq("revise"), any()))
          .thenThrow(
              new CollaboratorException(
                  CollaboratorType.LANGUAGE_MODEL, "revise", "rate limited", true));

      assertThatThrownBy(() -> revisionService.revise(workspace, "T1", "Expand", null))
          .isInstanceOf(CollaboratorException.class);

      assertThat(workspace.noteHistory("T1")).hasSize(1);
      List<ChatTurn> log = workspace.chatLog();
      assertThat(log).hasSize(2);
      assertThat(log.get(1).error()).isTrue();
      assertThat(log.get(1).noteRevision()).isEqualTo(1);
      assertThat(meterRegistry.counter("revision.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record an error turn and keep the note when rendering fails")
    void shouldRecordErrorTurn_whenRendererFails() throws Exception {
      NoteRenderer renderer = mock(NoteRenderer.class);
      when(renderer.render(any(NoteBody.class), eq(NoteFormat.MARKDOWN)))
          .thenReturn("# Cells")
          .thenThrow(new IllegalStateException("template missing"));
      NoteRevisionServiceImpl service =
          new NoteRevisionServiceImpl(
              revisionAgent, renderer, collaboratorGateway, new SmartNotesConfig(), meterRegistry);
      gatewayRunsCalls();
      when(revisionAgent.revise(anyString(), anyString(), anyString()))
          .thenReturn(revision("Done"));

      assertThatThrownBy(() -> service.revise(workspace, "T1", "Expand", null))
          .isInstanceOfSatisfying(
              CollaboratorException.class,
              e -> assertThat(e.getCollaborator()).isEqualTo(CollaboratorType.RENDERER));

      assertThat(workspace.noteHistory("T1")).hasSize(1);
      List<ChatTurn> log = workspace.chatLog();
      assertThat(log).hasSize(2);
      assertThat(log.get(1).sender()).isEqualTo(ChatSender.ASSISTANT);
      assertThat(log.get(1).error()).isTrue();
      assertThat(meterRegistry.counter("revision.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject an empty revision")
    void shouldThrow_whenRevisionEmpty() throws Exception {
      gatewayRunsCalls();
      when(revisionAgent.revise(anyString(), anyString(), anyString()))
          .thenReturn(new RevisionResponse(null, List.of(), "Nothing to do"));

      assertThatThrownBy(() -> revisionService.revise(workspace, "T1", "Expand", null))
          .isInstanceOfSatisfying(
              CollaboratorException.class, e -> assertThat(e.isRetriable()).isFalse());
      assertThat(workspace.chatLog()).extracting(ChatTurn::error).containsExactly(false, true);
    }

    @Test
    @DisplayName("should reject an instruction aimed at an outdated revision")
    void shouldThrowStale_whenExpectedRevisionOutdated() {
      workspace.addNote(note(cells, 2));

      assertThatThrownBy(() -> revisionService.revise(workspace, "T1", "Expand", 1))
          .isInstanceOf(StaleTargetException.class)
          .hasMessageContaining("revision 2 is current");
      verifyNoInteractions(collaboratorGateway, revisionAgent);
      assertThat(workspace.chatLog()).isEmpty();
    }

    @Test
    @DisplayName("should reject a note generated for an earlier topic version")
    void shouldThrowStale_whenNoteOutdated() {
      Topic mitosis = workspace.getGraph().get("T3").orElseThrow();
      workspace.addNote(note(mitosis.withVersion(0), 1));

      assertThatThrownBy(() -> revisionService.revise(workspace, "T3", "Expand", null))
          .isInstanceOf(StaleTargetException.class)
          .hasMessageContaining("earlier version");
    }

    @Test
    @DisplayName("should report a live topic without notes")
    void shouldThrowNotFound_whenTopicHasNoNote() {
      assertThatThrownBy(() -> revisionService.revise(workspace, "T2", "Expand", null))
          .isInstanceOf(NoteNotFoundException.class);
    }

    @Test
    @DisplayName("should point at the absorbing topic after a merge")
    void shouldThrowStale_whenTopicMerged() {
      Topic membranes = workspace.getGraph().get("T2").orElseThrow();
      List<SourceSpan> spans =
          List.of(cells.spans().get(0), membranes.spans().get(0));
      workspace
          .getGraph()
          .recordMerge(
              new Topic(workspace.getGraph().allocateKey(), "Cell basics", "", spans, 0),
              List.of("T1", "T2"));

      assertThatThrownBy(() -> revisionService.revise(workspace, "T1", "Expand", null))
          .isInstanceOfSatisfying(
              StaleTargetException.class,
              e -> assertThat(e.getUserMessage()).contains("merged into T4"));
    }

    @Test
    @DisplayName("should report keys that never existed")
    void shouldThrowTopicNotFound_whenKeyUnknown() {
      assertThatThrownBy(() -> revisionService.revise(workspace, "T42", "Expand", null))
          .isInstanceOf(TopicNotFoundException.class);
    }
  }
}
