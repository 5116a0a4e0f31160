package com.flamingo.ai.smartnotes.service.segmentation;

import com.flamingo.ai.smartnotes.domain.model.SegmentationHint;
import com.flamingo.ai.smartnotes.domain.model.SegmentationOutcome;

/** Turns raw content into topic proposals with disjoint source spans. */
public interface Segmenter {

  /**
   * Segments content under a granularity hint.
   *
   * @param content the document's full text
   * @param hint target resolution
   * @return proposals in document order, never empty
   * @throws com.flamingo.ai.smartnotes.exception.ExtractionInsufficientException if the content
   *     is empty or too short
   * @throws com.flamingo.ai.smartnotes.exception.SegmentationUpstreamException if the model is
   *     unavailable or keeps returning invalid output
   */
  SegmentationOutcome segment(String content, SegmentationHint hint);
}
