package com.flamingo.ai.smartnotes.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for merging topics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeTopicsRequest {

  @NotNull(message = "Topic keys are required")
  @Size(min = 2, message = "At least two topics are required")
  private List<String> topicKeys;
}
