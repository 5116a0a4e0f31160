package com.flamingo.ai.smartnotes.service.revision;

import com.flamingo.ai.smartnotes.agent.NoteRevisionAgent;
import com.flamingo.ai.smartnotes.agent.dto.RevisionResponse;
import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.enums.ContentProvenance;
import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;
import com.flamingo.ai.smartnotes.domain.model.NoteSection;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.NoteNotFoundException;
import com.flamingo.ai.smartnotes.exception.StaleTargetException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;
import com.flamingo.ai.smartnotes.service.render.NoteRenderer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link NoteRevisionService} backed by {@link NoteRevisionAgent}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteRevisionServiceImpl implements NoteRevisionService {

  private static final String DEFAULT_REPLY = "The note has been updated.";

  private final NoteRevisionAgent revisionAgent;
  private final NoteRenderer renderer;
  private final CollaboratorGateway collaboratorGateway;
  private final SmartNotesConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "revision.duration", description = "Time to apply a note revision")
  public Note revise(
      DocumentWorkspace workspace, String topicKey, String instruction, Integer expectedRevision) {
    Note current = currentNote(workspace, topicKey, expectedRevision);

    RevisionSession session = RevisionSession.of(workspace);
    String history =
        formatHistory(session.history(topicKey, config.getRevision().getHistoryWindow()));
    session.begin(topicKey, current.revision(), instruction);

    Note revised;
    String reply;
    try {
      String noteMarkdown = render(topicKey, current.body(), NoteFormat.MARKDOWN);
      RevisionResponse response =
          collaboratorGateway.call(
              CollaboratorType.LANGUAGE_MODEL,
              "revise",
              () -> revisionAgent.revise(history, noteMarkdown, instruction));
      NoteBody body = revisedBody(current.body(), response);
      String rendered = render(topicKey, body, current.format());
      revised =
          new Note(
              current.topicKey(),
              current.topicVersion(),
              current.revision() + 1,
              current.format(),
              body,
              rendered,
              current.partial(),
              current.warnings(),
              Instant.now());
      reply =
          response.reply() == null || response.reply().isBlank()
              ? DEFAULT_REPLY
              : response.reply().strip();
    } catch (CollaboratorException e) {
      session.fail(e.getUserMessage());
      meterRegistry.counter("revision.failed").increment();
      log.warn("Revision of {} r{} failed: {}", topicKey, current.revision(), e.getMessage());
      throw e;
    }

    workspace.addNote(revised);
    session.complete(reply, revised.revision());
    log.info(
        "Revised note {} of document {}: r{} -> r{}",
        topicKey,
        workspace.getId(),
        current.revision(),
        revised.revision());
    return revised;
  }

  private Note currentNote(DocumentWorkspace workspace, String topicKey, Integer expected) {
    Topic topic =
        workspace
            .getGraph()
            .get(topicKey)
            .orElseThrow(() -> workspace.unavailableTopic(topicKey));
    Note note =
        workspace
            .latestNote(topicKey)
            .orElseThrow(() -> new NoteNotFoundException(workspace.getId(), topicKey));
    if (!note.matches(topic)) {
      throw new StaleTargetException(
          topicKey,
          "The note for "
              + topicKey
              + " was generated for an earlier version of the topic. Regenerate it first.");
    }
    if (expected != null && expected != note.revision()) {
      throw new StaleTargetException(
          topicKey,
          "The note for "
              + topicKey
              + " has changed since revision "
              + expected
              + "; revision "
              + note.revision()
              + " is current.");
    }
    return note;
  }

  private String render(String topicKey, NoteBody body, NoteFormat format) {
    try {
      return renderer.render(body, format);
    } catch (RuntimeException e) {
      log.error("Rendering revision of {} as {} failed", topicKey, format, e);
      throw new CollaboratorException(
          CollaboratorType.RENDERER, "render", e.getMessage(), false, e);
    }
  }

  private static NoteBody revisedBody(NoteBody current, RevisionResponse response) {
    List<NoteSection> sections =
        response == null || response.sections() == null
            ? List.of()
            : response.sections().stream()
                .filter(s -> s != null && s.body() != null && !s.body().isBlank())
                .map(
                    s ->
                        new NoteSection(
                            s.heading() == null || s.heading().isBlank()
                                ? "Overview"
                                : s.heading().strip(),
                            s.body().strip(),
                            ContentProvenance.REVISION))
                .toList();
    String summary =
        response == null || response.summary() == null ? "" : response.summary().strip();
    if (sections.isEmpty() && summary.isEmpty()) {
      throw new CollaboratorException(
          CollaboratorType.LANGUAGE_MODEL, "revise", "model returned an empty revision", false);
    }
    return new NoteBody(
        current.anchor(),
        current.title(),
        summary,
        sections,
        current.images(),
        current.links());
  }

  private static String formatHistory(List<ChatTurn> turns) {
    if (turns.isEmpty()) {
      return "(none)";
    }
    return turns.stream()
        .map(turn -> turn.sender().name().toLowerCase(Locale.ROOT) + ": " + turn.message())
        .collect(Collectors.joining("\n"));
  }
}
