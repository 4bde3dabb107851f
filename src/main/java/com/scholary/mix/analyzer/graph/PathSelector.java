package com.scholary.mix.analyzer.graph;

import java.util.List;

/**
 * Policy for choosing a song ordering through a transition graph.
 *
 * <p>Implementations return a simple path: consecutive songs are joined by at least one edge and
 * no song repeats. No implementation claims optimality unless it says so.
 */
public interface PathSelector {

  /**
   * Choose a sequence of songs.
   *
   * @param graph the graph to search, not modified
   * @return song ids in play order, empty for an empty graph
   */
  List<String> findSequence(TransitionGraph graph);

  /**
   * Get the selector name for logging and debugging.
   *
   * @return selector name
   */
  String getSelectorName();
}
