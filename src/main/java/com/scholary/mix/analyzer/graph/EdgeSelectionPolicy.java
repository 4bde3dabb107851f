package com.scholary.mix.analyzer.graph;

import java.util.List;
import java.util.Optional;

/** Picks one edge among the admissible parallel edges of a hop. */
@FunctionalInterface
public interface EdgeSelectionPolicy {

  Optional<TransitionEdge> select(List<TransitionEdge> admissible);

  /** The edge with the latest {@code sourceEnd}; the first one wins a tie. */
  static EdgeSelectionPolicy maxSourceEnd() {
    return admissible -> {
      TransitionEdge best = null;
      for (TransitionEdge edge : admissible) {
        if (best == null || edge.sourceEnd() > best.sourceEnd()) {
          best = edge;
        }
      }
      return Optional.ofNullable(best);
    };
  }
}
