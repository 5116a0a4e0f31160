package com.flamingo.ai.smartnotes.domain.model;

import com.flamingo.ai.smartnotes.domain.enums.DocumentState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Committed state of one document: content, topic graph, note histories and chat log. This is the
 * unit the store loads and saves.
 *
 * <p>{@code segmentationReduced} is true when the last segmentation returned fewer topics than the
 * granularity asked for.
 */
public record WorkspaceSnapshot(
    UUID id,
    String title,
    String fileName,
    String content,
    List<MediaReference> media,
    int granularity,
    boolean segmentationReduced,
    DocumentState state,
    TopicGraphState graph,
    Map<String, List<Note>> notes,
    List<ChatTurn> chatLog,
    Instant createdAt,
    Instant updatedAt) {}
