package com.flamingo.ai.smartnotes.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for re-segmenting a document at a new granularity. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GranularityRequest {

  @NotNull(message = "Granularity is required")
  @Min(value = 0, message = "Granularity must be between 0 and 100")
  @Max(value = 100, message = "Granularity must be between 0 and 100")
  private Integer granularity;
}
