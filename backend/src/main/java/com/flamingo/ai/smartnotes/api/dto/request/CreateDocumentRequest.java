package com.flamingo.ai.smartnotes.api.dto.request;

import com.flamingo.ai.smartnotes.domain.model.MediaReference;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a document from plain text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDocumentRequest {

  @Size(max = 255, message = "Title must not exceed 255 characters")
  private String title;

  @NotBlank(message = "Content is required")
  private String content;

  /** Optional granularity 0-100. If null, the configured default is used. */
  @Min(value = 0, message = "Granularity must be between 0 and 100")
  @Max(value = 100, message = "Granularity must be between 0 and 100")
  private Integer granularity;

  /** Images referenced by offset into the content. */
  private List<MediaReference> media;
}
