package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;

/** A topic suggested by segmentation, before it is assigned a key. */
public record TopicProposal(String name, String description, List<SourceSpan> spans) {

  public TopicProposal {
    spans = spans == null ? List.of() : List.copyOf(spans);
  }
}
