package com.scholary.mix.analyzer.graph;

import com.scholary.mix.analyzer.transition.TransitionPair;

/**
 * One observed hand-off from {@code source} to {@code target}.
 *
 * @param source outgoing song id
 * @param target incoming song id
 * @param sourceEnd mix time where the outgoing song's audio ends, crossfade included
 * @param targetStart mix time where the incoming song starts
 * @param mixId mix the hand-off was observed in
 * @param pair the pair the edge was built from, null for hand-made edges
 */
public record TransitionEdge(
    String source,
    String target,
    double sourceEnd,
    double targetStart,
    String mixId,
    TransitionPair pair) {

  public static TransitionEdge fromPair(TransitionPair pair, double crossfadeSeconds) {
    return new TransitionEdge(
        pair.songX(),
        pair.songY(),
        pair.crossOutX() + crossfadeSeconds,
        pair.crossInY(),
        pair.mix(),
        pair);
  }
}
