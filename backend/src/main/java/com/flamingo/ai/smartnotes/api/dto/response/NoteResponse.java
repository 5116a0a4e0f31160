package com.flamingo.ai.smartnotes.api.dto.response;

import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.domain.model.NoteLink;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a note revision. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteResponse {

  private String topicKey;
  private long topicVersion;
  private int revision;
  private NoteFormat format;
  private String anchor;
  private String title;
  private String summary;
  private String content;
  private List<NoteLink> links;
  private boolean partial;
  private List<String> warnings;
  private Instant generatedAt;

  /** Creates a NoteResponse from a note. */
  public static NoteResponse fromNote(Note note) {
    return NoteResponse.builder()
        .topicKey(note.topicKey())
        .topicVersion(note.topicVersion())
        .revision(note.revision())
        .format(note.format())
        .anchor(note.body().anchor())
        .title(note.body().title())
        .summary(note.body().summary())
        .content(note.rendered())
        .links(note.body().links())
        .partial(note.partial())
        .warnings(note.warnings())
        .generatedAt(note.generatedAt())
        .build();
  }
}
