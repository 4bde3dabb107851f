package com.scholary.mix.analyzer.matching;

/**
 * Output of a {@link RefinementStrategy}.
 *
 * @param window the rough window the refinement started from
 * @param songStart start of the matched region in song seconds
 * @param songEnd end of the matched region in song seconds
 * @param mixStart start of the matched region in mix seconds
 * @param mixEnd end of the matched region in mix seconds
 * @param confidence strategy-specific confidence
 * @param status outcome; only {@link MatchStatus#isLocated()} statuses carry usable times
 */
public record RefinedMatch(
    MatchWindow window,
    double songStart,
    double songEnd,
    double mixStart,
    double mixEnd,
    double confidence,
    MatchStatus status) {

  /** The rough window taken as-is: the whole song placed at the rough start. */
  public static RefinedMatch fromWindow(MatchWindow window, MatchStatus status) {
    return new RefinedMatch(
        window,
        0.0,
        window.duration(),
        window.startInMix(),
        window.endInMix(),
        window.confidenceScore(),
        status);
  }

  /** Refinement gave up; the times repeat the rough window for diagnostics only. */
  public static RefinedMatch unlocated(MatchWindow window, MatchStatus status) {
    if (status.isLocated()) {
      throw new IllegalArgumentException(status + " is a located status");
    }
    return fromWindow(window, status);
  }

  public boolean isLocated() {
    return status.isLocated();
  }
}
