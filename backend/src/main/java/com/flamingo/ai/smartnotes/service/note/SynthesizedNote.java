package com.flamingo.ai.smartnotes.service.note;

import com.flamingo.ai.smartnotes.domain.model.HyperlinkEdge;
import com.flamingo.ai.smartnotes.domain.model.Note;
import java.util.List;
import java.util.Optional;

/**
 * A synthesized note together with the graph changes it implies. Nothing is recorded until the
 * caller commits it.
 *
 * @param note the new note revision
 * @param edges outgoing hyperlink edges of the topic
 * @param refinedName more precise topic name proposed by the draft, if any
 */
public record SynthesizedNote(Note note, List<HyperlinkEdge> edges, Optional<String> refinedName) {}
