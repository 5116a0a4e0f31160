package com.flamingo.ai.smartnotes.domain.model;

/**
 * An image embedded in the document content.
 *
 * @param id identifier unique within the document
 * @param offset character offset where the image appears
 * @param mimeType image MIME type
 * @param location file path or URL of the image bytes
 */
public record MediaReference(String id, int offset, String mimeType, String location) {}
