package com.flamingo.ai.smartnotes.api.dto.response;

import com.flamingo.ai.smartnotes.domain.model.NoteGenerationReport;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a note generation run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteGenerationResponse {

  private List<NoteResponse> generated;
  private List<String> skipped;

  /** Topic key to user-facing failure message. */
  private Map<String, String> failures;

  public static NoteGenerationResponse fromReport(NoteGenerationReport report) {
    return NoteGenerationResponse.builder()
        .generated(report.generated().stream().map(NoteResponse::fromNote).toList())
        .skipped(report.skipped())
        .failures(report.failures())
        .build();
  }
}
