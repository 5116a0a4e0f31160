package com.flamingo.ai.smartnotes.api.dto.request;

import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import com.flamingo.ai.smartnotes.domain.model.GenerateNotesOptions;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating notes. Every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateNotesRequest {

  /** markdown, latex or html. Defaults to markdown. */
  private String format;

  private boolean processImages;

  /** Topics to generate. If empty, every live topic is generated. */
  private List<String> topicKeys;

  private boolean force;

  public GenerateNotesOptions toOptions() {
    return new GenerateNotesOptions(
        NoteFormat.fromValue(format),
        processImages,
        topicKeys == null ? Set.of() : Set.copyOf(topicKeys),
        force);
  }
}
