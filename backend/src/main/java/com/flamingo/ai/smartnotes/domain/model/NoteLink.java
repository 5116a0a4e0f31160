package com.flamingo.ai.smartnotes.domain.model;

/** Outbound link of a note body to another topic's note. */
public record NoteLink(String targetKey, String anchorText) {}
