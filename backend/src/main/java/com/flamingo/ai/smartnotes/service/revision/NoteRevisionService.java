package com.flamingo.ai.smartnotes.service.revision;

import com.flamingo.ai.smartnotes.domain.model.Note;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;

/** Applies a user instruction to one topic's current note. */
public interface NoteRevisionService {

  /**
   * Revises the note of a topic, appending a user/assistant turn pair to the chat log.
   *
   * @param expectedRevision revision the caller saw, or null to target the latest
   * @return the new note revision
   * @throws com.flamingo.ai.smartnotes.exception.StaleTargetException if the note is out of date
   * @throws com.flamingo.ai.smartnotes.exception.CollaboratorException if the model fails; an
   *     error turn has been appended to the workspace and the note is unchanged
   */
  Note revise(
      DocumentWorkspace workspace, String topicKey, String instruction, Integer expectedRevision);
}
