package com.scholary.mix.analyzer.service;

import com.scholary.mix.analyzer.graph.EdgeResolver;
import com.scholary.mix.analyzer.graph.PathSelector;
import com.scholary.mix.analyzer.graph.TransitionEdge;
import com.scholary.mix.analyzer.graph.TransitionGraph;
import com.scholary.mix.analyzer.logging.StructuredLogger;
import com.scholary.mix.analyzer.transition.TransitionCandidate;
import com.scholary.mix.analyzer.transition.TransitionPair;
import com.scholary.mix.analyzer.transition.TransitionPairing;
import com.scholary.mix.analyzer.transition.TransitionProperties;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns located songs into a playable song order.
 *
 * <p>Candidates are paired per mix, the pairs become graph edges, the configured
 * {@link PathSelector} picks a song order and the {@link EdgeResolver} fixes one hand-off per hop.
 */
@Service
public class TransitionPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransitionPlanner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TransitionPairing pairing;
  private final PathSelector pathSelector;
  private final EdgeResolver edgeResolver;
  private final TransitionProperties properties;

  public TransitionPlanner(
      TransitionPairing pairing,
      PathSelector pathSelector,
      EdgeResolver edgeResolver,
      TransitionProperties properties) {
    this.pairing = pairing;
    this.pathSelector = pathSelector;
    this.edgeResolver = edgeResolver;
    this.properties = properties;
  }

  /**
   * Plan a song order from located songs.
   *
   * @param candidates songs located in mixes
   * @return the plan, empty when there are no candidates
   * @throws com.scholary.mix.analyzer.graph.GraphPathException if the chosen order cannot be
   *     realised with non-overlapping hand-offs
   */
  public TransitionPlan plan(Collection<TransitionCandidate> candidates) {
    TransitionGraph graph = buildGraph(candidates);
    if (graph.nodeCount() == 0) {
      return TransitionPlan.empty();
    }

    List<String> songs = pathSelector.findSequence(graph);
    structuredLogger.logPathSelected(
        pathSelector.getSelectorName(), graph.nodeCount(), graph.edgeCount(), songs.size());

    List<TransitionEdge> edges = edgeResolver.resolveEdges(graph, songs);
    return new TransitionPlan(songs, edges);
  }

  /** Every located song becomes a node and every hand-off pair an edge. */
  public TransitionGraph buildGraph(Collection<TransitionCandidate> candidates) {
    TransitionGraph graph = new TransitionGraph();
    for (TransitionCandidate candidate : candidates) {
      graph.addSong(candidate.songPath());
    }

    List<TransitionPair> pairs = pairing.pairTransitions(candidates);
    for (TransitionPair pair : pairs) {
      graph.addTransition(pair, properties.crossfadeSeconds());
    }

    LOGGER.info(
        "Built transition graph: {} songs, {} transitions from {} candidates",
        graph.nodeCount(),
        graph.edgeCount(),
        candidates.size());
    return graph;
  }
}
