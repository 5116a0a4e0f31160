package com.flamingo.ai.smartnotes.domain.model;

/**
 * Target resolution for segmentation derived from a granularity value.
 *
 * @param granularity clamped granularity in [0, 100]
 * @param minTopics lower bound the model is asked for
 * @param maxTopics topic-count ceiling, monotonic in granularity
 * @param guidance prose description of the desired topic breadth
 */
public record SegmentationHint(int granularity, int minTopics, int maxTopics, String guidance) {}
