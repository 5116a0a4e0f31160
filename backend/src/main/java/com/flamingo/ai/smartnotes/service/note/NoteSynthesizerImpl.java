package com.flamingo.ai.smartnotes.service.note;

import com.flamingo.ai.smartnotes.agent.NoteDraftAgent;
import com.flamingo.ai.smartnotes.agent.dto.NoteDraftResponse;
import com.flamingo.ai.smartnotes.agent.dto.NoteDraftResponse.DraftSection;
import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.domain.enums.ContentProvenance;
import com.flamingo.ai.smartnotes.domain.model.HyperlinkEdge;
import com.flamingo.ai.smartnotes.domain.model.ImageAttachment;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;
import com.flamingo.ai.smartnotes.domain.model.NoteLink;
import com.flamingo.ai.smartnotes.domain.model.NoteSection;
import com.flamingo.ai.smartnotes.domain.model.SynthesisOptions;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.SynthesisFailedException;
import com.flamingo.ai.smartnotes.service.collaborator.CollaboratorGateway;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;
import com.flamingo.ai.smartnotes.service.enrichment.Enricher;
import com.flamingo.ai.smartnotes.service.image.ImageAnalyzer;
import com.flamingo.ai.smartnotes.service.render.NoteRenderer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link NoteSynthesizer} drafting notes with {@link NoteDraftAgent}.
 *
 * <p>Only the draft is critical. Enrichment and image analysis failures mark the note {@code
 * partial} and are listed in its warnings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteSynthesizerImpl implements NoteSynthesizer {

  static final String ENRICHMENT_HEADING = "Further context";
  private static final String DEFAULT_HEADING = "Overview";
  private static final int MAX_TITLE_LENGTH = 120;

  private final NoteDraftAgent draftAgent;
  private final Enricher enricher;
  private final ImageAnalyzer imageAnalyzer;
  private final NoteRenderer renderer;
  private final HyperlinkScorer hyperlinkScorer;
  private final CollaboratorGateway collaboratorGateway;
  private final SmartNotesConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "synthesis.duration", description = "Time to synthesize one note")
  public SynthesizedNote synthesize(
      Topic topic, DocumentWorkspace document, SynthesisOptions options) {
    SmartNotesConfig.Synthesis settings = config.getSynthesis();
    String sourceText = document.textOf(topic);
    String promptText =
        sourceText.length() > settings.getMaxSourceChars()
            ? sourceText.substring(0, settings.getMaxSourceChars())
            : sourceText;

    NoteDraftResponse draft = draft(topic, promptText);
    List<NoteSection> sections = new ArrayList<>(sourceSections(draft));
    List<String> warnings = new ArrayList<>();
    boolean partial = false;

    boolean thin = sourceText.strip().length() < settings.getThinTopicChars() || draft.uncertain();
    if (thin) {
      String summary = isBlank(draft.summary()) ? promptText : draft.summary();
      try {
        String supplement = enricher.supplement(topic.name(), summary);
        sections.add(new NoteSection(ENRICHMENT_HEADING, supplement, ContentProvenance.ENRICHMENT));
      } catch (CollaboratorException e) {
        partial = true;
        warnings.add("Enrichment unavailable: " + e.getUserMessage());
        log.warn("Enrichment failed for topic {}: {}", topic.key(), e.getMessage());
      }
    }

    List<ImageAttachment> images = new ArrayList<>();
    if (options.processImages()) {
      for (MediaReference ref : document.mediaOf(topic)) {
        try {
          images.add(new ImageAttachment(ref.id(), ref.location(), imageAnalyzer.describe(ref)));
        } catch (CollaboratorException e) {
          partial = true;
          warnings.add("Image " + ref.id() + " could not be analysed: " + e.getUserMessage());
          log.warn("Image analysis failed for {} in topic {}: {}", ref.id(), topic.key(),
              e.getMessage());
        }
      }
    }

    Optional<String> refinedName = refinedName(topic, draft, settings);
    List<HyperlinkEdge> edges =
        hyperlinkScorer.score(
            topic, nullToEmpty(draft.summary()), document.getGraph().list());
    List<NoteLink> links =
        edges.stream().map(edge -> new NoteLink(edge.targetKey(), edge.anchorText())).toList();

    NoteBody body =
        new NoteBody(
            NoteBody.anchorFor(topic.key()),
            refinedName.orElse(topic.name()),
            nullToEmpty(draft.summary()).strip(),
            sections,
            images,
            links);
    String rendered = render(topic, body, options);

    Note note =
        new Note(
            topic.key(),
            topic.version(),
            document.nextNoteRevision(topic.key()),
            options.format(),
            body,
            rendered,
            partial,
            warnings,
            Instant.now());
    if (partial) {
      meterRegistry.counter("notes.partial").increment();
    }
    log.debug(
        "Synthesized note {} r{} ({} sections, {} links, partial={})",
        topic.key(),
        note.revision(),
        sections.size(),
        links.size(),
        partial);
    return new SynthesizedNote(note, edges, refinedName);
  }

  private NoteDraftResponse draft(Topic topic, String sourceText) {
    NoteDraftResponse draft;
    try {
      draft =
          collaboratorGateway.call(
              CollaboratorType.LANGUAGE_MODEL,
              "summarize",
              () -> draftAgent.draft(topic.name(), topic.description(), sourceText));
    } catch (CollaboratorException e) {
      throw new SynthesisFailedException(topic.key(), e.getMessage(), e.isRetriable(), e);
    }
    boolean hasSection =
        draft != null
            && draft.sections() != null
            && draft.sections().stream().anyMatch(s -> s != null && !isBlank(s.body()));
    if (draft == null || (!hasSection && isBlank(draft.summary()))) {
      throw new SynthesisFailedException(topic.key(), "model returned an empty draft", true, null);
    }
    return draft;
  }

  private static List<NoteSection> sourceSections(NoteDraftResponse draft) {
    if (draft.sections() == null) {
      return List.of();
    }
    return draft.sections().stream()
        .filter(s -> s != null && !isBlank(s.body()))
        .map(NoteSynthesizerImpl::toSection)
        .toList();
  }

  static NoteSection toSection(DraftSection section) {
    String heading = isBlank(section.heading()) ? DEFAULT_HEADING : section.heading().strip();
    return new NoteSection(heading, section.body().strip(), ContentProvenance.SOURCE);
  }

  private static Optional<String> refinedName(
      Topic topic, NoteDraftResponse draft, SmartNotesConfig.Synthesis settings) {
    if (!settings.isAdoptRefinedNames() || isBlank(draft.title())) {
      return Optional.empty();
    }
    String title = draft.title().strip();
    if (title.length() > MAX_TITLE_LENGTH || title.equalsIgnoreCase(topic.name().strip())) {
      return Optional.empty();
    }
    return Optional.of(title);
  }

  private String render(Topic topic, NoteBody body, SynthesisOptions options) {
    try {
      return renderer.render(body, options.format());
    } catch (RuntimeException e) {
      log.error("Rendering note for {} as {} failed", topic.key(), options.format(), e);
      throw new CollaboratorException(
          CollaboratorType.RENDERER, "render", e.getMessage(), false, e);
    }
  }

  private static boolean isBlank(String text) {
    return text == null || text.isBlank();
  }

  private static String nullToEmpty(String text) {
    return text == null ? "" : text;
  }
}
