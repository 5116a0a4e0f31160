package com.flamingo.ai.smartnotes.api.dto.response;

import com.flamingo.ai.smartnotes.domain.model.SourceSpan;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import com.flamingo.ai.smartnotes.domain.model.TopicView;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a live topic. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicResponse {

  private String key;
  private String name;
  private String description;
  private long version;
  private List<SourceSpan> spans;
  private int ownedLength;
  private int noteRevision;
  private boolean noteFresh;

  /** Creates a TopicResponse from a topic with its note status. */
  public static TopicResponse fromView(TopicView view) {
    return fromTopic(view.topic(), view.noteRevision(), view.noteFresh());
  }

  /** Creates a TopicResponse for a topic that has no note yet. */
  public static TopicResponse fromTopic(Topic topic) {
    return fromTopic(topic, 0, false);
  }

  private static TopicResponse fromTopic(Topic topic, int noteRevision, boolean noteFresh) {
    return TopicResponse.builder()
        .key(topic.key())
        .name(topic.name())
        .description(topic.description())
        .version(topic.version())
        .spans(topic.spans())
        .ownedLength(topic.ownedLength())
        .noteRevision(noteRevision)
        .noteFresh(noteFresh)
        .build();
  }
}
