package com.flamingo.ai.smartnotes.domain.model;

/** An analysed image attached to a note. */
public record ImageAttachment(String mediaId, String location, String description) {}
