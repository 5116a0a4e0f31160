package com.flamingo.ai.smartnotes.domain.model;

import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;

/** Per-note synthesis options. */
public record SynthesisOptions(NoteFormat format, boolean processImages) {}
