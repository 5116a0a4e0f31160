package com.flamingo.ai.smartnotes.agent.dto;

import java.util.List;

/** Structured output from NoteRevisionAgent. */
public record RevisionResponse(
    String summary, List<NoteDraftResponse.DraftSection> sections, String reply) {}
