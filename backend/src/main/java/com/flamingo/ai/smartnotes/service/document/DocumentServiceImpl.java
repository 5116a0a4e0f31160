package com.flamingo.ai.smartnotes.service.document;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import com.flamingo.ai.smartnotes.domain.model.ExtractedContent;
import com.flamingo.ai.smartnotes.domain.model.GenerateNotesOptions;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteBody;
import com.flamingo.ai.smartnotes.domain.model.NoteGenerationReport;
import com.flamingo.ai.smartnotes.domain.model.NoteLink;
import com.flamingo.ai.smartnotes.domain.model.SegmentationOutcome;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicView;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.DocumentNotFoundException;
import com.flamingo.ai.smartnotes.exception.InputException;
import com.flamingo.ai.smartnotes.exception.NoteNotFoundException;
import com.flamingo.ai.smartnotes.exception.StaleTargetException;
import com.flamingo.ai.smartnotes.service.extraction.Extractor;
import com.flamingo.ai.smartnotes.service.granularity.GranularityMapper;
import com.flamingo.ai.smartnotes.service.merge.MergeEngine;
import com.flamingo.ai.smartnotes.service.note.NoteSynthesizer;
import com.flamingo.ai.smartnotes.service.note.SynthesizedNote;
import com.flamingo.ai.smartnotes.service.render.NoteRenderer;
import com.flamingo.ai.smartnotes.service.revision.NoteRevisionService;
import com.flamingo.ai.smartnotes.service.segmentation.Segmenter;
import com.flamingo.ai.smartnotes.service.store.DocumentStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Implementation of the DocumentService.
 *
 * <p>Every mutation runs under the document lock on a private {@link DocumentWorkspace} restored
 * from the committed snapshot and is saved once at the end. A failure before the save leaves the
 * committed snapshot untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final long MAX_UPLOAD_BYTES = 50L * 1024 * 1024;

  private final DocumentStore documentStore;
  private final DocumentLockRegistry lockRegistry;
  private final GranularityMapper granularityMapper;
  private final Segmenter segmenter;
  private final MergeEngine mergeEngine;
  private final NoteSynthesizer noteSynthesizer;
  private final NoteRevisionService noteRevisionService;
  private final NoteRenderer noteRenderer;
  private final Extractor extractor;
  private final SmartNotesConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.create", description = "Time to create and segment a document")
  public WorkspaceSnapshot createDocument(
      String title, String content, List<MediaReference> media, Integer granularity) {
    return create(title, null, content, media, granularity);
  }

  @Override
  @Timed(value = "document.upload", description = "Time to upload a document")
  public WorkspaceSnapshot uploadDocument(MultipartFile file, String title, Integer granularity) {
    if (file == null || file.isEmpty()) {
      throw new InputException("File is empty", "Please upload a non-empty file.");
    }
    if (file.getSize() > MAX_UPLOAD_BYTES) {
      throw new InputException("File too large: " + file.getSize(), "Maximum file size is 50MB.");
    }
    log.info("Uploading document {} ({} bytes)", file.getOriginalFilename(), file.getSize());

    ExtractedContent extracted;
    try (InputStream in = file.getInputStream()) {
      extracted = extractor.extract(in, file.getOriginalFilename(), file.getContentType());
    } catch (IOException e) {
      throw new InputException(
          "Cannot read upload: " + e.getMessage(), "The uploaded file could not be read.");
    }
    String effectiveTitle =
        title == null || title.isBlank() ? stripExtension(file.getOriginalFilename()) : title;
    return create(
        effectiveTitle,
        file.getOriginalFilename(),
        extracted.text(),
        extracted.media(),
        granularity);
  }

  @Override
  public WorkspaceSnapshot getDocument(UUID documentId) {
    return load(documentId);
  }

  @Override
  public List<WorkspaceSnapshot> listDocuments() {
    return documentStore.list();
  }

  @Override
  @Timed(value = "document.granularity", description = "Time to re-segment a document")
  public WorkspaceSnapshot setGranularity(UUID documentId, int granularity) {
    validateGranularity(granularity);
    return mutate(
        documentId,
        workspace -> {
          workspace.setGranularity(granularity);
          segmentInto(workspace);
          log.info(
              "Re-segmented document {} at granularity {}: {} topics",
              documentId,
              granularity,
              workspace.getGraph().size());
        });
  }

  @Override
  @Timed(value = "topics.merge", description = "Time to merge topics")
  public Topic mergeTopics(UUID documentId, Collection<String> topicKeys) {
    return lockRegistry.runExclusive(
        documentId,
        () -> {
          DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
          Topic merged = mergeEngine.merge(workspace.getGraph(), topicKeys);
          commit(workspace);
          return merged;
        });
  }

  @Override
  @Timed(value = "notes.generate", description = "Time to generate notes")
  public NoteGenerationReport generateNotes(UUID documentId, GenerateNotesOptions options) {
    GenerateNotesOptions effective = options == null ? GenerateNotesOptions.defaults() : options;
    return lockRegistry.runExclusive(
        documentId,
        () -> {
          DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
          List<Topic> targets = targets(workspace, effective);

          List<Note> generated = new ArrayList<>();
          List<String> skipped = new ArrayList<>();
          Map<String, String> failures = new LinkedHashMap<>();
          CollaboratorException firstFailure = null;

          for (Topic target : targets) {
            Optional<Note> fresh = workspace.freshNote(target.key());
            if (!effective.force()
                && fresh.isPresent()
                && fresh.get().format() == effective.format()) {
              skipped.add(target.key());
              continue;
            }
            // Names may have been refined by earlier iterations.
            Topic topic = workspace.getGraph().get(target.key()).orElse(target);
            try {
              SynthesizedNote result =
                  noteSynthesizer.synthesize(topic, workspace, effective.synthesisOptions());
              workspace.addNote(result.note());
              workspace.getGraph().replaceOutgoingEdges(topic.key(), result.edges());
              result
                  .refinedName()
                  .ifPresent(name -> workspace.getGraph().rename(topic.key(), name));
              generated.add(result.note());
            } catch (CollaboratorException e) {
              failures.put(topic.key(), e.getUserMessage());
              firstFailure = firstFailure == null ? e : firstFailure;
              log.warn("Note generation failed for topic {}: {}", topic.key(), e.getMessage());
            }
          }

          if (generated.isEmpty() && firstFailure != null) {
            throw firstFailure;
          }
          if (!generated.isEmpty()) {
            commit(workspace);
          }
          log.info(
              "Generated {} notes for document {} ({} skipped, {} failed)",
              generated.size(),
              documentId,
              skipped.size(),
              failures.size());
          return new NoteGenerationReport(generated, skipped, failures);
        });
  }

  @Override
  @Timed(value = "notes.revise", description = "Time to revise a note")
  public Note reviseNote(
      UUID documentId, String topicKey, String instruction, Integer expectedRevision) {
    if (instruction == null || instruction.isBlank()) {
      throw new InputException("Blank instruction", "Please describe how to change the note.");
    }
    int max = config.getRevision().getMaxInstructionChars();
    if (instruction.length() > max) {
      throw new InputException(
          "Instruction too long: " + instruction.length(),
          "Instructions are limited to " + max + " characters.");
    }
    return lockRegistry.runExclusive(
        documentId,
        () -> {
          DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
          try {
            Note revised =
                noteRevisionService.revise(
                    workspace, topicKey, instruction.strip(), expectedRevision);
            commit(workspace);
            return revised;
          } catch (CollaboratorException e) {
            // The error turn is part of the log even though the note is unchanged.
            commit(workspace);
            throw e;
          }
        });
  }

  @Override
  public List<TopicView> listTopics(UUID documentId) {
    DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
    return workspace.getGraph().list().stream()
        .map(
            topic ->
                new TopicView(
                    topic,
                    workspace.latestNote(topic.key()).map(Note::revision).orElse(0),
                    workspace.freshNote(topic.key()).isPresent()))
        .toList();
  }

  @Override
  public Note getNote(UUID documentId, String topicKey) {
    DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
    Topic topic =
        workspace
            .getGraph()
            .get(topicKey)
            .orElseThrow(() -> workspace.unavailableTopic(topicKey));
    Note note =
        workspace
            .latestNote(topicKey)
            .orElseThrow(() -> new NoteNotFoundException(documentId, topicKey));
    if (!note.matches(topic)) {
      throw new StaleTargetException(
          topicKey,
          "The note for " + topicKey + " is out of date because the topic changed. "
              + "Regenerate it to get a current version.");
    }
    return withResolvedLinks(workspace, note);
  }

  @Override
  public List<Note> getCurrentNotes(UUID documentId) {
    DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
    return workspace.currentNotes().stream()
        .map(note -> withResolvedLinks(workspace, note))
        .toList();
  }

  @Override
  public List<Note> getNoteHistory(UUID documentId, String topicKey) {
    DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
    if (!workspace.getGraph().isLive(topicKey) && !workspace.hasNotes(topicKey)) {
      throw workspace.unavailableTopic(topicKey);
    }
    return workspace.noteHistory(topicKey);
  }

  @Override
  public List<ChatTurn> getChatHistory(UUID documentId, String topicKey) {
    List<ChatTurn> turns = load(documentId).chatLog();
    if (topicKey == null || topicKey.isBlank()) {
      return turns;
    }
    return turns.stream().filter(turn -> topicKey.equals(turn.topicKey())).toList();
  }

  @Override
  public void deleteDocument(UUID documentId) {
    lockRegistry.runExclusive(
        documentId,
        () -> {
          if (!documentStore.exists(documentId)) {
            throw new DocumentNotFoundException(documentId);
          }
          documentStore.delete(documentId);
          return null;
        });
    lockRegistry.forget(documentId);
    meterRegistry.counter("document.deleted").increment();
    log.info("Deleted document {}", documentId);
  }

  // ---- helpers ----

  private WorkspaceSnapshot create(
      String title,
      String fileName,
      String content,
      List<MediaReference> media,
      Integer granularity) {
    int g = granularity == null ? GranularityMapper.DEFAULT_GRANULARITY : granularity;
    validateGranularity(g);
    if (content == null || content.isBlank()) {
      throw new InputException("Empty content", "The document has no text content.");
    }
    int max = config.getDocument().getMaxContentChars();
    if (content.length() > max) {
      throw new InputException(
          "Content too large: " + content.length(),
          "The document is too large (maximum " + max + " characters).");
    }
    validateMedia(media);

    UUID id = UUID.randomUUID();
    String effectiveTitle = title == null || title.isBlank() ? "Untitled document" : title.strip();
    return lockRegistry.runExclusive(
        id,
        () -> {
          DocumentWorkspace workspace =
              DocumentWorkspace.create(
                  id, effectiveTitle, fileName, content, media, g, Instant.now());
          segmentInto(workspace);
          WorkspaceSnapshot saved = commit(workspace);
          meterRegistry.counter("document.created").increment();
          log.info(
              "Created document {} '{}' ({} chars, granularity {}): {} topics",
              id,
              effectiveTitle,
              content.length(),
              g,
              workspace.getGraph().size());
          return saved;
        });
  }

  private void segmentInto(DocumentWorkspace workspace) {
    SegmentationOutcome outcome =
        segmenter.segment(
            workspace.getContent(), granularityMapper.map(workspace.getGranularity()));
    workspace
        .getGraph()
        .apply(outcome.proposals(), config.getSegmentation().isAllowUnassigned());
    workspace.setSegmentationReduced(outcome.reduced());
  }

  private WorkspaceSnapshot mutate(UUID documentId, Consumer<DocumentWorkspace> change) {
    return lockRegistry.runExclusive(
        documentId,
        () -> {
          DocumentWorkspace workspace = DocumentWorkspace.fromSnapshot(load(documentId));
          change.accept(workspace);
          return commit(workspace);
        });
  }

  private WorkspaceSnapshot commit(DocumentWorkspace workspace) {
    workspace.refreshState();
    workspace.touch(Instant.now());
    WorkspaceSnapshot snapshot = workspace.toSnapshot();
    documentStore.save(snapshot);
    return snapshot;
  }

  private WorkspaceSnapshot load(UUID documentId) {
    return documentStore
        .load(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  private List<Topic> targets(DocumentWorkspace workspace, GenerateNotesOptions options) {
    if (options.topicKeys().isEmpty()) {
      return workspace.getGraph().list();
    }
    List<Topic> targets = new ArrayList<>();
    for (Topic topic : workspace.getGraph().list()) {
      if (options.topicKeys().contains(topic.key())) {
        targets.add(topic);
      }
    }
    for (String key : options.topicKeys()) {
      if (!workspace.getGraph().isLive(key)) {
        throw workspace.unavailableTopic(key);
      }
    }
    return targets;
  }

  /** Re-renders a note whose stored links no longer match the graph's edges. */
  private Note withResolvedLinks(DocumentWorkspace workspace, Note note) {
    List<NoteLink> links =
        workspace.getGraph().outgoing(note.topicKey()).stream()
            .map(edge -> new NoteLink(edge.targetKey(), edge.anchorText()))
            .toList();
    if (links.equals(note.body().links())) {
      return note;
    }
    NoteBody body = note.body().withLinks(links);
    return note.withRendering(body, noteRenderer.render(body, note.format()));
  }

  /** Media locations are relative paths inside the media directory. */
  private static void validateMedia(List<MediaReference> media) {
    if (media == null) {
      return;
    }
    for (MediaReference ref : media) {
      String location = ref == null ? null : ref.location();
      if (location == null || location.isBlank()) {
        throw new InputException("Media without location", "Every image needs a location.");
      }
      Path path;
      try {
        path = Path.of(location).normalize();
      } catch (InvalidPathException e) {
        throw new InputException(
            "Invalid media location: " + location, "Image location " + location + " is invalid.");
      }
      if (path.isAbsolute() || path.startsWith("..")) {
        throw new InputException(
            "Media location escapes the media directory: " + location,
            "Image locations must be relative to the media directory.");
      }
    }
  }

  private static void validateGranularity(int granularity) {
    if (granularity < 0 || granularity > 100) {
      throw new InputException(
          "Granularity out of range: " + granularity, "Granularity must be between 0 and 100.");
    }
  }

  private static String stripExtension(String fileName) {
    if (fileName == null) {
      return null;
    }
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
