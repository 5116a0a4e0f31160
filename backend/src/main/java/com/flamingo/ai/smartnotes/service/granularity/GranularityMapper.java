package com.flamingo.ai.smartnotes.service.granularity;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.model.SegmentationHint;
import org.springframework.stereotype.Component;

/**
 * Maps a granularity value to a segmentation hint.
 *
 * <p>Pure and total: values outside [0, 100] are clamped. The topic-count ceiling grows linearly
 * from {@code granularity.min-topics} at 0 to {@code granularity.max-topics} at 100, so it never
 * decreases as granularity increases.
 */
@Component
public class GranularityMapper {

  public static final int DEFAULT_GRANULARITY = 50;

  private final int minTopics;
  private final int maxTopics;

  public GranularityMapper(SmartNotesConfig config) {
    int min = config.getGranularity().getMinTopics();
    int max = config.getGranularity().getMaxTopics();
    if (min < 1 || max < min) {
      throw new IllegalStateException(
          "Invalid granularity topic range: min-topics=" + min + ", max-topics=" + max);
    }
    this.minTopics = min;
    this.maxTopics = max;
  }

  public SegmentationHint map(int granularity) {
    int g = Math.max(0, Math.min(100, granularity));
    int ceiling = minTopics + (int) Math.round((maxTopics - minTopics) * g / 100.0);
    int floor = Math.max(1, ceiling / 2);
    return new SegmentationHint(g, floor, ceiling, guidance(g));
  }

  private static String guidance(int g) {
    if (g < 20) {
      return "very broad: only the few overarching macro-topics of the document";
    }
    if (g < 40) {
      return "general: major macro-topics, each spanning a large part of the document";
    }
    if (g < 60) {
      return "balanced: a mix of main topics and important sub-topics";
    }
    if (g < 80) {
      return "specific: distinct sub-topics, splitting broad themes into their parts";
    }
    return "fine-grained: individual concepts, definitions and techniques as separate topics";
  }
}
