package com.flamingo.ai.smartnotes.domain.model;

import com.flamingo.ai.smartnotes.domain.enums.ContentProvenance;

/** One headed section of a note body. Body text is Markdown. */
public record NoteSection(String heading, String body, ContentProvenance provenance) {}
