package com.flamingo.ai.smartnotes.agent;

import com.flamingo.ai.smartnotes.agent.dto.RevisionResponse;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent applying a user's free-form instruction to one study note. */
public interface NoteRevisionAgent {

  @SystemMessage(
      """
        You revise a single study note according to the user's instruction. Keep the note about
        the same topic. Do not invent links to other notes. Apply only what the instruction asks
        for and keep the rest of the note intact.

        Return ONLY valid JSON matching this structure:
        {"summary": "...", "sections": [{"heading": "...", "body": "..."}],
         "reply": "one sentence telling the user what changed"}
        """)
  @UserMessage(
      """
        Earlier conversation about this note:
        {{history}}

        Current note (Markdown):
        {{note}}

        Instruction:
        {{instruction}}
        """)
  RevisionResponse revise(
      @V("history") String history,
      @V("note") String note,
      @V("instruction") String instruction);
}
