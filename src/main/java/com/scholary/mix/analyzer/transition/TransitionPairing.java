package com.scholary.mix.analyzer.transition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds hand-off pairs from songs located in the same mix.
 *
 * <p>Every ordered pair of different songs whose gap lies strictly between the bounds becomes a
 * pair. Nothing is deduplicated or ranked: one song may hand over to several others, and the
 * path search decides later.
 */
@Component
public class TransitionPairing {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransitionPairing.class);

  private final TransitionProperties properties;

  public TransitionPairing(TransitionProperties properties) {
    this.properties = properties;
  }

  public List<TransitionPair> pairTransitions(Collection<TransitionCandidate> candidates) {
    return pairTransitions(candidates, properties.maxGapSeconds(), properties.minGapSeconds());
  }

  /**
   * Pair candidates per mix.
   *
   * @param candidates located songs, any mixes
   * @param maxGap exclusive upper bound on {@code Y.crossIn - X.crossOut}
   * @param minGap exclusive lower bound on {@code Y.crossIn - X.crossOut}
   * @return pairs grouped by mix in first-seen order, X-major within a mix
   */
  public static List<TransitionPair> pairTransitions(
      Collection<TransitionCandidate> candidates, double maxGap, double minGap) {
    Map<String, List<TransitionCandidate>> byMix = new LinkedHashMap<>();
    for (TransitionCandidate candidate : candidates) {
      byMix.computeIfAbsent(candidate.mixPath(), k -> new ArrayList<>()).add(candidate);
    }

    List<TransitionPair> pairs = new ArrayList<>();
    for (Map.Entry<String, List<TransitionCandidate>> entry : byMix.entrySet()) {
      List<TransitionCandidate> inMix = entry.getValue();
      for (TransitionCandidate x : inMix) {
        for (TransitionCandidate y : inMix) {
          if (x.songPath().equals(y.songPath())) {
            continue;
          }
          double gap = y.crossIn() - x.crossOut();
          if (minGap < gap && gap < maxGap) {
            pairs.add(
                new TransitionPair(
                    x.songPath(),
                    y.songPath(),
                    entry.getKey(),
                    x.offset(),
                    y.offset(),
                    x.crossOut(),
                    y.crossIn()));
          }
        }
      }
    }

    LOGGER.debug(
        "Paired {} candidates across {} mixes into {} transitions",
        candidates.size(),
        byMix.size(),
        pairs.size());
    return pairs;
  }
}
