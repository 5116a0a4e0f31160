package com.flamingo.ai.smartnotes.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for revising a note through chat. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevisionRequest {

  @NotBlank(message = "Instruction is required")
  @Size(max = 10000, message = "Instruction must not exceed 10000 characters")
  private String instruction;

  /** Note revision the client last saw. If set and outdated, the request is rejected. */
  private Integer expectedRevision;
}
