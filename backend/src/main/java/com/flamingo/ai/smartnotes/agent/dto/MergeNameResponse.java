package com.flamingo.ai.smartnotes.agent.dto;

/** Structured output from TopicMergeNamingAgent. */
public record MergeNameResponse(String name, String description) {}
