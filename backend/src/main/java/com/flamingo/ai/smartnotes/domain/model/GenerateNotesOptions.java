package com.flamingo.ai.smartnotes.domain.model;

import com.flamingo.ai.smartnotes.domain.enums.NoteFormat;
import java.util.Set;

/**
 * Options for a note generation run.
 *
 * @param format target format
 * @param processImages analyse images referenced by each topic's spans
 * @param topicKeys topics to generate; empty means every live topic
 * @param force regenerate even when a fresh note in the same format exists
 */
public record GenerateNotesOptions(
    NoteFormat format, boolean processImages, Set<String> topicKeys, boolean force) {

  public GenerateNotesOptions {
    format = format == null ? NoteFormat.MARKDOWN : format;
    topicKeys = topicKeys == null ? Set.of() : Set.copyOf(topicKeys);
  }

  public static GenerateNotesOptions defaults() {
    return new GenerateNotesOptions(NoteFormat.MARKDOWN, false, Set.of(), false);
  }

  public SynthesisOptions synthesisOptions() {
    return new SynthesisOptions(format, processImages);
  }
}
