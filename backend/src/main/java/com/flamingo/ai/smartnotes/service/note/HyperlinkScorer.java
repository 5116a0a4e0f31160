package com.flamingo.ai.smartnotes.service.note;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.model.HyperlinkEdge;
import com.flamingo.ai.smartnotes.domain.model.Topic;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores a topic against every other topic by Jaccard word overlap and keeps the strongest links.
 *
 * <p>Edges are kept above {@code synthesis.similarity-threshold}, capped at {@code
 * synthesis.max-out-degree}, never to the topic itself and never to topics whose name is shorter
 * than {@code synthesis.min-anchor-length}.
 */
@Component
@RequiredArgsConstructor
public class HyperlinkScorer {

  private static final int MIN_TOKEN_LENGTH = 3;

  private final SmartNotesConfig config;

  public List<HyperlinkEdge> score(Topic source, String sourceText, List<Topic> candidates) {
    SmartNotesConfig.Synthesis settings = config.getSynthesis();
    Set<String> sourceTokens =
        tokens(source.name() + " " + source.description() + " " + sourceText);
    if (sourceTokens.isEmpty()) {
      return List.of();
    }

    List<Scored> scored = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      Topic target = candidates.get(i);
      if (target.key().equals(source.key())
          || target.name().strip().length() < settings.getMinAnchorLength()) {
        continue;
      }
      double similarity =
          jaccard(sourceTokens, tokens(target.name() + " " + target.description()));
      if (similarity > settings.getSimilarityThreshold()) {
        scored.add(new Scored(target, similarity, i));
      }
    }

    return scored.stream()
        .sorted(
            Comparator.comparingDouble(Scored::similarity).reversed()
                .thenComparingInt(Scored::order))
        .limit(Math.max(0, settings.getMaxOutDegree()))
        .map(s -> new HyperlinkEdge(source.key(), s.topic().key(), s.topic().name()))
        .toList();
  }

  static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    return (double) intersection.size() / union.size();
  }

  static Set<String> tokens(String text) {
    Set<String> tokens = new HashSet<>();
    if (text == null) {
      return tokens;
    }
    for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (token.length() >= MIN_TOKEN_LENGTH) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private record Scored(Topic topic, double similarity, int order) {}
}
