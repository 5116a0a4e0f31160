package com.flamingo.ai.smartnotes.service.revision;

import com.flamingo.ai.smartnotes.domain.enums.ChatSender;
import com.flamingo.ai.smartnotes.domain.enums.RevisionState;
import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import com.flamingo.ai.smartnotes.service.document.DocumentWorkspace;
import java.time.Instant;
import java.util.List;

/**
 * Conversational state machine for one document: {@code IDLE -> AWAITING_RESPONSE -> IDLE}.
 *
 * <p>A turn is opened with {@link #begin} and closed by exactly one of {@link #complete} or {@link
 * #fail}; both append a user turn followed by an assistant turn to the document's chat log.
 *
 * <p>A session lives for one revision call made under the document lock, so two turns are never in
 * flight for the same document. Opening a second turn on the same session is a programming error.
 */
public final class RevisionSession {

  private final DocumentWorkspace workspace;
  private RevisionState state = RevisionState.IDLE;
  private String topicKey;
  private int noteRevision;
  private String instruction;

  private RevisionSession(DocumentWorkspace workspace) {
    this.workspace = workspace;
  }

  public static RevisionSession of(DocumentWorkspace workspace) {
    return new RevisionSession(workspace);
  }

  public void begin(String topicKey, int noteRevision, String instruction) {
    if (state != RevisionState.IDLE) {
      throw new IllegalStateException("Revision turn already in progress for " + this.topicKey);
    }
    this.topicKey = topicKey;
    this.noteRevision = noteRevision;
    this.instruction = instruction;
    this.state = RevisionState.AWAITING_RESPONSE;
  }

  /** Records a successful turn; {@code newRevision} is the revision the reply produced. */
  public void complete(String reply, int newRevision) {
    requireAwaiting();
    Instant now = Instant.now();
    workspace.appendTurn(ChatSender.USER, topicKey, noteRevision, instruction, false, now);
    workspace.appendTurn(ChatSender.ASSISTANT, topicKey, newRevision, reply, false, now);
    state = RevisionState.IDLE;
  }

  /** Records a failed turn; the note stays at the revision the instruction targeted. */
  public void fail(String errorMessage) {
    requireAwaiting();
    Instant now = Instant.now();
    workspace.appendTurn(ChatSender.USER, topicKey, noteRevision, instruction, false, now);
    workspace.appendTurn(ChatSender.ASSISTANT, topicKey, noteRevision, errorMessage, true, now);
    state = RevisionState.IDLE;
  }

  /** Last {@code window} turns about the given topic, oldest first. */
  public List<ChatTurn> history(String key, int window) {
    List<ChatTurn> forTopic =
        workspace.chatLog().stream().filter(turn -> key.equals(turn.topicKey())).toList();
    int from = Math.max(0, forTopic.size() - Math.max(0, window));
    return forTopic.subList(from, forTopic.size());
  }

  public RevisionState state() {
    return state;
  }

  private void requireAwaiting() {
    if (state != RevisionState.AWAITING_RESPONSE) {
      throw new IllegalStateException("No revision turn in progress");
    }
  }
}
