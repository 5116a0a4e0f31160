package com.flamingo.ai.smartnotes.service.segmentation;

/**
 * A numbered block of content. Consecutive blocks tile the content: each block ends where the
 * next one starts.
 */
public record ContentBlock(int index, int start, int end, String text) {}
