package com.flamingo.ai.smartnotes.domain.model;

/**
 * A live topic with the status of its current note.
 *
 * @param topic the topic
 * @param noteRevision latest note revision, 0 when none exists
 * @param noteFresh true when the latest note matches the topic version
 */
public record TopicView(Topic topic, int noteRevision, boolean noteFresh) {}
