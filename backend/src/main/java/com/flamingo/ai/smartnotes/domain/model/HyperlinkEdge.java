package com.flamingo.ai.smartnotes.domain.model;

/** Directed cross-reference between two topics' notes. */
public record HyperlinkEdge(String sourceKey, String targetKey, String anchorText) {}
