package com.flamingo.ai.smartnotes.domain.model;

/** A downloadable file. */
public record NoteFile(String fileName, String mimeType, byte[] content) {}
