package com.scholary.mix.analyzer.service;

import com.scholary.mix.analyzer.matching.MatchStatus;
import com.scholary.mix.analyzer.matching.MatchWindow;
import com.scholary.mix.analyzer.matching.RefinedMatch;
import com.scholary.mix.analyzer.transition.TransitionCandidate;
import java.util.Optional;

/**
 * Result of comparing one song against one mix.
 *
 * @param comparison the song and mix compared
 * @param status overall status
 * @param roughWindow the rough window, null if no rough match was found
 * @param refined the refinement output, null if refinement did not run
 * @param strategy name of the refinement strategy, null if it did not run
 * @param message failure detail, null on success
 */
public record MatchOutcome(
    Comparison comparison,
    MatchStatus status,
    MatchWindow roughWindow,
    RefinedMatch refined,
    String strategy,
    String message) {

  public static MatchOutcome refined(
      Comparison comparison, RefinedMatch refined, String strategy) {
    return new MatchOutcome(
        comparison, refined.status(), refined.window(), refined, strategy, null);
  }

  public static MatchOutcome failed(Comparison comparison, MatchStatus status, String message) {
    return new MatchOutcome(comparison, status, null, null, null, message);
  }

  public boolean isLocated() {
    return refined != null && refined.isLocated();
  }

  /** The located song as a transition candidate, empty if it was not located. */
  public Optional<TransitionCandidate> toCandidate() {
    return refined == null ? Optional.empty() : TransitionCandidate.fromMatch(refined);
  }
}
