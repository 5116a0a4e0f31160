package com.flamingo.ai.smartnotes.domain.model;

import java.util.Comparator;

/**
 * Half-open character range {@code [start, end)} of a document's content.
 *
 * <p>Validation against the content length happens in the topic graph, not here, so a malformed
 * span can be reported with the topic that claimed it.
 */
public record SourceSpan(int start, int end) {

  /** Orders spans by start, then end. */
  public static final Comparator<SourceSpan> BY_POSITION =
      Comparator.comparingInt(SourceSpan::start).thenComparingInt(SourceSpan::end);

  public int length() {
    return end - start;
  }

  public boolean overlaps(SourceSpan other) {
    return start < other.end && other.start < end;
  }

  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  @Override
  public String toString() {
    return "[" + start + "," + end + ")";
  }
}
