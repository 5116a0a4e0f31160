package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a note generation run.
 *
 * @param generated notes created in this run
 * @param skipped topic keys that already had a fresh note
 * @param failures topic key to user-facing failure message
 */
public record NoteGenerationReport(
    List<Note> generated, List<String> skipped, Map<String, String> failures) {

  public NoteGenerationReport {
    generated = List.copyOf(generated);
    skipped = List.copyOf(skipped);
    failures = Map.copyOf(failures);
  }
}
