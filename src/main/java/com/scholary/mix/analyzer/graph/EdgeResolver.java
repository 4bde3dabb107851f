package com.scholary.mix.analyzer.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a song sequence into concrete edges, one per hop.
 *
 * <p>An edge is admissible for a hop when its {@code sourceEnd} is not before the previous
 * chosen edge's {@code targetStart}; the {@link EdgeSelectionPolicy} picks among the admissible
 * ones. A hop with no edge at all, or with every edge excluded, fails the whole resolution.
 */
public class EdgeResolver {

  private final EdgeSelectionPolicy policy;

  public EdgeResolver() {
    this(EdgeSelectionPolicy.maxSourceEnd());
  }

  public EdgeResolver(EdgeSelectionPolicy policy) {
    this.policy = policy;
  }

  /**
   * Resolve the edges of a path.
   *
   * @param graph the graph the path was selected from
   * @param path song ids in play order
   * @return one edge per consecutive pair, empty for paths shorter than two songs
   * @throws GraphPathException if some hop has no admissible edge
   */
  public List<TransitionEdge> resolveEdges(TransitionGraph graph, List<String> path) {
    List<TransitionEdge> resolved = new ArrayList<>();
    TransitionEdge previous = null;

    for (int i = 0; i + 1 < path.size(); i++) {
      String source = path.get(i);
      String target = path.get(i + 1);
      List<TransitionEdge> edges = graph.edgesBetween(source, target);
      if (edges.isEmpty()) {
        throw new GraphPathException("No transition from " + source + " to " + target);
      }

      List<TransitionEdge> admissible = new ArrayList<>();
      for (TransitionEdge edge : edges) {
        if (previous == null || edge.sourceEnd() >= previous.targetStart()) {
          admissible.add(edge);
        }
      }
      if (admissible.isEmpty()) {
        throw new GraphPathException(
            String.format(
                "All %d transitions from %s to %s end before the previous hand-off at %.2fs",
                edges.size(), source, target, previous.targetStart()));
      }

      TransitionEdge chosen =
          policy
              .select(admissible)
              .orElseThrow(
                  () ->
                      new GraphPathException(
                          "No transition selected from " + source + " to " + target));
      resolved.add(chosen);
      previous = chosen;
    }
    return resolved;
  }
}
