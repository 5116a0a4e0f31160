package com.flamingo.ai.smartnotes.domain.model;

import com.flamingo.ai.smartnotes.domain.enums.ChatSender;
import java.time.Instant;

/**
 * One entry of a document's append-only revision log.
 *
 * @param sequence position in the log, starting at 1
 * @param sender author of the message
 * @param topicKey topic whose note was targeted
 * @param noteRevision note revision the instruction was applied against
 * @param message message text
 * @param error true for turns reporting a failed revision
 * @param timestamp creation time
 */
public record ChatTurn(
    long sequence,
    ChatSender sender,
    String topicKey,
    int noteRevision,
    String message,
    boolean error,
    Instant timestamp) {}
