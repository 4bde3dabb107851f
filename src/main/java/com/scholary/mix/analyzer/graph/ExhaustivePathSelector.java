package com.scholary.mix.analyzer.graph;

import com.scholary.mix.analyzer.matching.AnalysisTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Exact longest simple path by depth-first search over every start.
 *
 * <p>The search keeps its own stack instead of recursing, so long chains cannot overflow the
 * thread stack. Its cost is exponential in general; once more than {@code expansionLimit} path
 * extensions have been tried it gives up with an {@link AnalysisTimeoutException}. Among paths of
 * equal length the first one found wins (starts and successors in insertion order).
 */
public class ExhaustivePathSelector implements PathSelector {

  private final long expansionLimit;

  public ExhaustivePathSelector(long expansionLimit) {
    this.expansionLimit = expansionLimit;
  }

  @Override
  public List<String> findSequence(TransitionGraph graph) {
    int n = graph.nodeCount();
    int[] best = new int[0];
    long expansions = 0;

    int[] path = new int[n];
    int[] nextChild = new int[n];
    BitSet visited = new BitSet(n);

    for (int start = 0; start < n; start++) {
      int depth = 0;
      path[0] = start;
      nextChild[0] = 0;
      visited.set(start);
      if (best.length < 1) {
        best = new int[] {start};
      }

      while (depth >= 0) {
        List<Integer> successors = graph.successors(path[depth]);
        int child = -1;
        while (nextChild[depth] < successors.size()) {
          int candidate = successors.get(nextChild[depth]++);
          if (!visited.get(candidate)) {
            child = candidate;
            break;
          }
        }

        if (child < 0) {
          visited.clear(path[depth]);
          depth--;
          continue;
        }

        if (++expansions > expansionLimit) {
          throw new AnalysisTimeoutException(
              "Longest path search exceeded " + expansionLimit + " expansions");
        }
        depth++;
        path[depth] = child;
        nextChild[depth] = 0;
        visited.set(child);
        if (depth + 1 > best.length) {
          best = Arrays.copyOf(path, depth + 1);
        }
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
    return "exhaustive";
  }
}
