package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;

/** Plain text plus media references produced by an extractor. */
public record ExtractedContent(String text, List<MediaReference> media) {

  public ExtractedContent {
    media = media == null ? List.of() : List.copyOf(media);
  }
}
