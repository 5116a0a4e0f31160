package com.flamingo.ai.smartnotes.exception;

/** Exception thrown when content is empty or too short to segment. */
public class ExtractionInsufficientException extends InputException {

  private final int contentLength;
  private final int minimumLength;

  public ExtractionInsufficientException(int contentLength, int minimumLength) {
    super(
        "Content too short to segment: " + contentLength + " chars, minimum " + minimumLength,
        contentLength == 0
            ? "No text could be extracted from the document."
            : "The document does not contain enough text to build notes from (at least "
                + minimumLength
                + " characters are needed).");
    this.contentLength = contentLength;
    this.minimumLength = minimumLength;
  }

  public int getContentLength() {
    return contentLength;
  }

  public int getMinimumLength() {
    return minimumLength;
  }
}
