package com.flamingo.ai.smartnotes.api.dto.response;

import com.flamingo.ai.smartnotes.domain.enums.DocumentState;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicView;
import com.flamingo.ai.smartnotes.domain.model.WorkspaceSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String title;
  private String fileName;
  private int contentLength;
  private int granularity;

  /** True when segmentation produced fewer topics than the granularity asked for. */
  private boolean segmentationReduced;

  private DocumentState state;
  private List<TopicResponse> topics;
  private List<SourceSpan> unassigned;
  private int chatTurnCount;
  private Instant createdAt;
  private Instant updatedAt;

  /** Creates a DocumentResponse from a committed snapshot. */
  public static DocumentResponse fromSnapshot(WorkspaceSnapshot snapshot) {
    List<TopicResponse> topics =
        snapshot.graph().topics().stream()
            .map(topic -> TopicResponse.fromView(view(topic, snapshot)))
            .toList();
    return DocumentResponse.builder()
        .id(snapshot.id())
        .title(snapshot.title())
        .fileName(snapshot.fileName())
        .contentLength(snapshot.content().length())
        .granularity(snapshot.granularity())
        .segmentationReduced(snapshot.segmentationReduced())
        .state(snapshot.state())
        .topics(topics)
        .unassigned(snapshot.graph().unassigned())
        .chatTurnCount(snapshot.chatLog().size())
        .createdAt(snapshot.createdAt())
        .updatedAt(snapshot.updatedAt())
        .build();
  }

  private static TopicView view(Topic topic, WorkspaceSnapshot snapshot) {
    List<Note> history = snapshot.notes().getOrDefault(topic.key(), List.of());
    if (history.isEmpty()) {
      return new TopicView(topic, 0, false);
    }
    Note latest = history.get(history.size() - 1);
    return new TopicView(topic, latest.revision(), latest.matches(topic));
  }
}
