package com.flamingo.ai.smartnotes.agent.dto;

import java.util.List;

/** Structured output from NoteDraftAgent. */
public record NoteDraftResponse(
    String title,
    String summary,
    List<DraftSection> sections,
    boolean uncertain // model self-report that the source was too thin
    ) {

  /** A drafted note section; body is Markdown. */
  public record DraftSection(String heading, String body) {}
}
