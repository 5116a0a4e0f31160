package com.flamingo.ai.smartnotes.domain.enums;

import java.util.Locale;

/** Output format of a rendered note. */
public enum NoteFormat {
  MARKDOWN(".md", "text/markdown"),
  LATEX(".tex", "application/x-latex"),
  HTML(".html", "text/html");

  private final String extension;
  private final String mimeType;

  NoteFormat(String extension, String mimeType) {
    this.extension = extension;
    this.mimeType = mimeType;
  }

  public String getExtension() {
    return extension;
  }

  public String getMimeType() {
    return mimeType;
  }

  /**
   * Resolves a format from its name or a common alias ("md", "tex").
   *
   * @throws IllegalArgumentException if the value names no format
   */
  public static NoteFormat fromValue(String value) {
    if (value == null || value.isBlank()) {
      return MARKDOWN;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "markdown", "md" -> MARKDOWN;
      case "latex", "tex" -> LATEX;
      case "html", "htm" -> HTML;
      default -> throw new IllegalArgumentException("Unsupported note format: " + value);
    };
  }
}
