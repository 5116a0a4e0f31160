package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;

/**
 * A named partition unit of a document's content.
 *
 * @param key stable key, unique within the document and never reused
 * @param name human-readable name
 * @param description one or two sentence description
 * @param spans owned source spans, ordered by position
 * @param version bumped whenever the span set changes
 */
public record Topic(
    String key, String name, String description, List<SourceSpan> spans, long version) {

  public Topic {
    spans = spans == null ? List.of() : spans.stream().sorted(SourceSpan.BY_POSITION).toList();
    description = description == null ? "" : description;
  }

  public Topic withName(String newName) {
    return new Topic(key, newName, description, spans, version);
  }

  public Topic withVersion(long newVersion) {
    return new Topic(key, name, description, spans, newVersion);
  }

  /** Total number of characters owned. */
  public int ownedLength() {
    return spans.stream().mapToInt(SourceSpan::length).sum();
  }

  public boolean covers(int offset) {
    return spans.stream().anyMatch(span -> span.contains(offset));
  }
}
