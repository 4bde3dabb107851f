package com.scholary.mix.analyzer.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * Beam search for a long simple path.
 *
 * <p>From every song as a start, partial paths are extended by one song at a time. After each
 * step only the {@code beamWidth} candidates with the highest {@link PathHeuristic} score are
 * kept, ties in insertion order. A path that cannot be extended competes on song count; the
 * first longest one over all starts wins. A width of 1 is greedy and {@link Integer#MAX_VALUE}
 * explores everything. The result is a heuristic answer, not a guaranteed longest path.
 */
public class BeamSearchPathSelector implements PathSelector {

  private final int beamWidth;
  private final PathHeuristic heuristic;

  public BeamSearchPathSelector(int beamWidth) {
    this(beamWidth, PathHeuristic.unvisitedOutEdges());
  }

  public BeamSearchPathSelector(int beamWidth, PathHeuristic heuristic) {
    if (beamWidth < 1) {
      throw new IllegalArgumentException("Beam width must be at least 1");
    }
    this.beamWidth = beamWidth;
    this.heuristic = heuristic;
  }

  @Override
  public List<String> findSequence(TransitionGraph graph) {
    int[] best = new int[0];

    for (int start = 0; start < graph.nodeCount(); start++) {
      List<PartialPath> beam = new ArrayList<>();
      beam.add(PartialPath.of(start, graph.nodeCount()));

      while (!beam.isEmpty()) {
        List<PartialPath> next = new ArrayList<>();
        for (PartialPath path : beam) {
          boolean extended = false;
          for (int target : graph.successors(path.last())) {
            if (!path.visited.get(target)) {
              PartialPath longer = path.extend(target);
              longer.score = heuristic.score(graph, target, longer.visited);
              next.add(longer);
              extended = true;
            }
          }
          if (!extended && path.nodes.length > best.length) {
            best = path.nodes;
          }
        }
        // List.sort is stable, so equal scores keep insertion order
        next.sort(Comparator.comparingDouble((PartialPath p) -> p.score).reversed());
        beam = next.size() > beamWidth ? new ArrayList<>(next.subList(0, beamWidth)) : next;
      }
    }

    List<String> ids = new ArrayList<>(best.length);
    for (int node : best) {
      ids.add(graph.idOf(node));
    }
    return ids;
  }

  @Override
  public String getSelectorName() {
    return "beam(k=" + (beamWidth == Integer.MAX_VALUE ? "inf" : beamWidth) + ")";
  }

  private static final class PartialPath {
    final int[] nodes;
    final BitSet visited;
    double score;

    PartialPath(int[] nodes, BitSet visited) {
      this.nodes = nodes;
      this.visited = visited;
    }

    static PartialPath of(int start, int nodeCount) {
      BitSet visited = new BitSet(nodeCount);
      visited.set(start);
      return new PartialPath(new int[] {start}, visited);
    }

    int last() {
      return nodes[nodes.length - 1];
    }

    PartialPath extend(int target) {
      int[] longer = Arrays.copyOf(nodes, nodes.length + 1);
      longer[nodes.length] = target;
      BitSet nextVisited = (BitSet) visited.clone();
      nextVisited.set(target);
      return new PartialPath(longer, nextVisited);
    }
  }
}
