package com.scholary.mix.analyzer.matching;

/**
 * Where a song was found in a mix, in mix seconds.
 *
 * <p>For a rough match {@code endInMix - startInMix} is exactly the song duration.
 */
public record MatchWindow(
    String songPath, String mixPath, double startInMix, double endInMix, double confidenceScore) {

  public MatchWindow {
    if (startInMix < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endInMix < startInMix) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return endInMix - startInMix;
  }
}
