package com.scholary.mix.analyzer.graph;

import java.util.BitSet;

/** Ranks partial paths during beam search; higher scores are kept first. */
@FunctionalInterface
public interface PathHeuristic {

  /**
   * Score a partial path.
   *
   * @param graph the graph being searched
   * @param lastNode index of the path's last song
   * @param visited indices already on the path, including {@code lastNode}
   * @return the score
   */
  double score(TransitionGraph graph, int lastNode, BitSet visited);

  /** Number of the last song's outgoing edges that lead to a song not yet on the path. */
  static PathHeuristic unvisitedOutEdges() {
    return (graph, lastNode, visited) -> {
      int count = 0;
      for (TransitionEdge edge : graph.getOutEdges(lastNode)) {
        if (!visited.get(graph.indexOf(edge.target()))) {
          count++;
        }
      }
      return count;
    };
  }
}
