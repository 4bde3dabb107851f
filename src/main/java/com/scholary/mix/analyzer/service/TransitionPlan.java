package com.scholary.mix.analyzer.service;

import com.scholary.mix.analyzer.graph.TransitionEdge;
import java.util.List;

/**
 * A chosen song order and the concrete hand-off used between each consecutive pair.
 *
 * @param songs song ids in play order
 * @param edges one edge per consecutive pair of {@code songs}
 */
public record TransitionPlan(List<String> songs, List<TransitionEdge> edges) {

  public TransitionPlan {
    songs = List.copyOf(songs);
    edges = List.copyOf(edges);
    if (!songs.isEmpty() && edges.size() != songs.size() - 1) {
      throw new IllegalArgumentException(
          "Expected " + (songs.size() - 1) + " edges for " + songs.size() + " songs");
    }
  }

  public static TransitionPlan empty() {
    return new TransitionPlan(List.of(), List.of());
  }

  public boolean isEmpty() {
    return songs.isEmpty();
  }
}
