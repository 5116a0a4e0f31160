package com.flamingo.ai.smartnotes.domain.model;

import java.util.List;

/**
 * Result of a segmentation run.
 *
 * @param proposals topics in document order
 * @param reduced true when fewer topics came back than the hint asked for
 * @param attempts number of model calls it took
 */
public record SegmentationOutcome(List<TopicProposal> proposals, boolean reduced, int attempts) {

  public SegmentationOutcome {
    proposals = List.copyOf(proposals);
  }
}
