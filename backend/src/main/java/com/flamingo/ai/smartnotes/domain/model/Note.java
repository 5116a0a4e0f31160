package com.flamingo.ai.smartnotes.domain.model;

import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import java.time.Instant;
import java.util.List;

/**
 * Rendered artifact for exactly one topic version.
 *
 * @param topicKey bound topic
 * @param topicVersion topic version the note was derived from
 * @param revision content revision, starting at 1 per topic
 * @param format output format of {@code rendered}
 * @param body structured content
 * @param rendered body rendered in {@code format}
 * @param partial true when enrichment or image analysis was unavailable
 * @param warnings human-readable notes about degraded steps
 * @param generatedAt creation time of this revision
 */
public record Note(
    String topicKey,
    long topicVersion,
    int revision,
    NoteFormat format,
    NoteBody body,
    String rendered,
    boolean partial,
    List<String> warnings,
    Instant generatedAt) {

  public Note {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public Note withRendering(NoteBody newBody, String newRendered) {
    return new Note(
        topicKey, topicVersion, revision, format, newBody, newRendered, partial, warnings,
        generatedAt);
  }

  /** True when this note was derived from the given topic's current version. */
  public boolean matches(Topic topic) {
    return topic != null && topic.key().equals(topicKey) && topic.version() == topicVersion;
  }
}
