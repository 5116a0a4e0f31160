package com.flamingo.ai.smartnotes.service.document;

import com.flamingo.ai.smartnotes.domain.enums.ChatSender;
import com.flamingo.ai.smartnotes.domain.enums.DocumentState;
import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicGraphState;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import com.flamingo.ai.smartnotes.exception.StaleTargetException;
import com.flamingo.ai.smartnotes.exception.TopicNotFoundException;
import com.flamingo.ai.smartnotes.service.graph.TopicGraph;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Private, mutable copy of one document used for the duration of a single operation.
 *
 * <p>Restored from a committed {@link WorkspaceSnapshot}, mutated under the document lock and
 * converted back with {@link #toSnapshot()} for an all-or-nothing save. Note histories and the
 * chat log are append-only.
 */
public class DocumentWorkspace {

  private final UUID id;
  private final String title;
  private final String fileName;
  private final String content;
  private final List<MediaReference> media;
  private final Instant createdAt;
  private final LinkedHashMap<String, List<Note>> notes = new LinkedHashMap<>();
  private final List<ChatTurn> chatLog = new ArrayList<>();
  private int granularity;
  private boolean segmentationReduced;
  private DocumentState state;
  private TopicGraph graph;
  private Instant updatedAt;

  private DocumentWorkspace(
      UUID id,
      String title,
      String fileName,
      String content,
      List<MediaReference> media,
      int granularity,
      Instant createdAt) {
    this.id = id;
    this.title = title;
    this.fileName = fileName;
    this.content = content;
    this.media = media == null ? List.of() : List.copyOf(media);
    this.granularity = granularity;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
    this.state = DocumentState.UPLOADED;
    this.graph = new TopicGraph(content.length());
  }

  public static DocumentWorkspace create(
      UUID id,
      String title,
      String fileName,
      String content,
      List<MediaReference> media,
      int granularity,
      Instant now) {
    return new DocumentWorkspace(id, title, fileName, content, media, granularity, now);
  }

  public static DocumentWorkspace fromSnapshot(WorkspaceSnapshot snapshot) {
    DocumentWorkspace workspace =
        new DocumentWorkspace(
            snapshot.id(),
            snapshot.title(),
            snapshot.fileName(),
            snapshot.content(),
            snapshot.media(),
            snapshot.granularity(),
            snapshot.createdAt());
    workspace.segmentationReduced = snapshot.segmentationReduced();
    workspace.state = snapshot.state();
    workspace.updatedAt = snapshot.updatedAt();
    TopicGraphState graphState =
        snapshot.graph() == null
            ? TopicGraphState.empty(snapshot.content().length())
            : snapshot.graph();
    workspace.graph = TopicGraph.restore(graphState);
    if (snapshot.notes() != null) {
      snapshot
          .notes()
          .forEach((key, history) -> workspace.notes.put(key, new ArrayList<>(history)));
    }
    if (snapshot.chatLog() != null) {
      workspace.chatLog.addAll(snapshot.chatLog());
    }
    return workspace;
  }

  public WorkspaceSnapshot toSnapshot() {
    Map<String, List<Note>> noteCopy =
        notes.entrySet().stream()
            .collect(
                Collectors.toMap(
                    Map.Entry::getKey,
                    entry -> List.copyOf(entry.getValue()),
                    (a, b) -> a,
                    LinkedHashMap::new));
    return new WorkspaceSnapshot(
        id,
        title,
        fileName,
        content,
        media,
        granularity,
        segmentationReduced,
        state,
        graph.toState(),
        noteCopy,
        List.copyOf(chatLog),
        createdAt,
        updatedAt);
  }

  // ---- notes ----

  /** Latest revision recorded for a topic key, fresh or not. */
  public Optional<Note> latestNote(String topicKey) {
    List<Note> history = notes.get(topicKey);
    return history == null || history.isEmpty()
        ? Optional.empty()
        : Optional.of(history.get(history.size() - 1));
  }

  /** Latest note when it was derived from the topic's current version. */
  public Optional<Note> freshNote(String topicKey) {
    Optional<Topic> topic = graph.get(topicKey);
    return latestNote(topicKey).filter(note -> topic.isPresent() && note.matches(topic.get()));
  }

  public List<Note> noteHistory(String topicKey) {
    return List.copyOf(notes.getOrDefault(topicKey, List.of()));
  }

  public boolean hasNotes(String topicKey) {
    return notes.containsKey(topicKey) && !notes.get(topicKey).isEmpty();
  }

  public int nextNoteRevision(String topicKey) {
    return latestNote(topicKey).map(note -> note.revision() + 1).orElse(1);
  }

  public void addNote(Note note) {
    notes.computeIfAbsent(note.topicKey(), key -> new ArrayList<>()).add(note);
  }

  /** Every note that is the fresh current note of a live topic, in topic order. */
  public List<Note> currentNotes() {
    return graph.list().stream()
        .map(topic -> freshNote(topic.key()))
        .flatMap(Optional::stream)
        .toList();
  }

  /**
   * Error for a key that is not a live topic: stale when the key once existed, not found
   * otherwise.
   */
  public RuntimeException unavailableTopic(String topicKey) {
    if (graph.isTombstoned(topicKey)) {
      String absorber = graph.resolve(topicKey).orElse("another topic");
      return new StaleTargetException(
          topicKey,
          "Topic " + topicKey + " was merged into " + absorber + ". Generate notes for "
              + absorber + " to continue.");
    }
    if (hasNotes(topicKey)) {
      return new StaleTargetException(
          topicKey, "Topic " + topicKey + " no longer exists after re-segmentation.");
    }
    return new TopicNotFoundException(id, topicKey);
  }

  // ---- chat ----

  public ChatTurn appendTurn(
      ChatSender sender,
      String topicKey,
      int noteRevision,
      String message,
      boolean error,
      Instant now) {
    ChatTurn turn =
        new ChatTurn(chatLog.size() + 1L, sender, topicKey, noteRevision, message, error, now);
    chatLog.add(turn);
    return turn;
  }

  public List<ChatTurn> chatLog() {
    return List.copyOf(chatLog);
  }

  // ---- content ----

  /** Text owned by a topic, spans joined by blank lines. */
  public String textOf(Topic topic) {
    return topic.spans().stream()
        .map(span -> content.substring(span.start(), span.end()).strip())
        .filter(text -> !text.isEmpty())
        .collect(Collectors.joining("\n\n"));
  }

  /** Media whose offset falls inside one of the topic's spans. */
  public List<MediaReference> mediaOf(Topic topic) {
    return media.stream().filter(ref -> topic.covers(ref.offset())).toList();
  }

  public List<SourceSpan> unassigned() {
    return graph.unassigned();
  }

  // ---- lifecycle ----

  /** Recomputes the lifecycle state from the graph and notes. */
  public void refreshState() {
    if (graph.size() == 0) {
      state = DocumentState.UPLOADED;
    } else if (graph.list().stream().allMatch(topic -> freshNote(topic.key()).isPresent())) {
      state = DocumentState.NOTES_GENERATED;
    } else {
      state = DocumentState.SEGMENTED;
    }
  }

  public void touch(Instant now) {
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getContent() {
    return content;
  }

  public List<MediaReference> getMedia() {
    return media;
  }

  public int getGranularity() {
    return granularity;
  }

  public void setGranularity(int granularity) {
    this.granularity = granularity;
  }

  public boolean isSegmentationReduced() {
    return segmentationReduced;
  }

  public void setSegmentationReduced(boolean segmentationReduced) {
    this.segmentationReduced = segmentationReduced;
  }

  public DocumentState getState() {
    return state;
  }

  public TopicGraph getGraph() {
    return graph;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
