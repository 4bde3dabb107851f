package com.scholary.mix.analyzer.transition;

import com.scholary.mix.analyzer.matching.MatchWindow;
import com.scholary.mix.analyzer.matching.RefinedMatch;
import java.util.Optional;

/**
 * A song located in a mix (an "XT" record).
 *
 * <p>{@code crossIn} and {@code crossOut} are the mix times where the song starts and stops being
 * audible; {@code offset} maps mix time to song time as {@code songTime = mixTime - offset}.
 */
public record TransitionCandidate(
    String songPath, String mixPath, double offset, double crossIn, double crossOut) {

  public TransitionCandidate {
    if (songPath == null || mixPath == null) {
      throw new IllegalArgumentException("Song and mix paths are required");
    }
    if (!(crossIn < crossOut)) {
      throw new IllegalArgumentException(
          "Cross-in must be before cross-out: " + crossIn + " >= " + crossOut);
    }
  }

  /**
   * Build a candidate from a refined match.
   *
   * @return the candidate, or empty if the match is not located or covers no time
   */
  public static Optional<TransitionCandidate> fromMatch(RefinedMatch match) {
    if (!match.isLocated() || !(match.mixStart() < match.mixEnd())) {
      return Optional.empty();
    }
    MatchWindow window = match.window();
    return Optional.of(
        new TransitionCandidate(
            window.songPath(),
            window.mixPath(),
            match.mixStart() - match.songStart(),
            match.mixStart(),
            match.mixEnd()));
  }
}
