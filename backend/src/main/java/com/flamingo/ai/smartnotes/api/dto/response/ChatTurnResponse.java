package com.flamingo.ai.smartnotes.api.dto.response;

import com.flamingo.ai.smartnotes.domain.enums.ChatSender;
import com.flamingo.ai.smartnotes.domain.model.ChatTurn;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one revision chat turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurnResponse {

  private long sequence;
  private ChatSender sender;
  private String topicKey;
  private int noteRevision;
  private String message;
  private boolean error;
  private Instant timestamp;

  public static ChatTurnResponse fromTurn(ChatTurn turn) {
    return ChatTurnResponse.builder()
        .sequence(turn.sequence())
        .sender(turn.sender())
        .topicKey(turn.topicKey())
        .noteRevision(turn.noteRevision())
        .message(turn.message())
        .error(turn.error())
        .timestamp(turn.timestamp())
        .build();
  }
}
