package com.scholary.mix.analyzer.matching;

import com.scholary.mix.analyzer.dsp.CrossCorrelator;
import com.scholary.mix.analyzer.fingerprint.Fingerprint;
import com.scholary.mix.analyzer.logging.StructuredLogger;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the approximate position of a whole song in a mix.
 *
 * <p>Both chroma matrices are standardised to zero mean and unit variance, the song is slid
 * across the mix with a valid-mode cross-correlation summed over the 12 channels, and the best
 * frame wins. The window always spans exactly the song's duration.
 */
@Component
public class RoughMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RoughMatcher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final MatchingProperties properties;

  public RoughMatcher(MatchingProperties properties) {
    this.properties = properties;
  }

  /**
   * Locate a song in a mix.
   *
   * @param song fingerprint of the song
   * @param mix fingerprint of the mix
   * @return the best window, or empty if the song is longer than the mix or the best score is
   *     below the confidence threshold
   * @throws AnalysisTimeoutException if the mix exceeds {@code maxCorrelationFrames}
   */
  public Optional<MatchWindow> roughMatch(Fingerprint song, Fingerprint mix) {
    checkCompatible(song, mix);
    if (song.frameCount() == 0 || song.frameCount() > mix.frameCount()) {
      LOGGER.debug(
          "Song ({} frames) does not fit in mix ({} frames)", song.frameCount(), mix.frameCount());
      return Optional.empty();
    }
    checkBudget(mix.frameCount(), properties.maxCorrelationFrames());

    double[] scores =
        CrossCorrelator.correlateValid(
            CrossCorrelator.normalize(mix.features()), CrossCorrelator.normalize(song.features()));
    int bestFrame = CrossCorrelator.argMax(scores);
    double bestScore = scores[bestFrame];

    double start = mix.framesToSeconds(bestFrame);
    double end = start + song.durationSeconds();

    if (bestScore < properties.rough().confidenceThreshold()) {
      structuredLogger.logRoughMatch(start, end, bestScore, false);
      return Optional.empty();
    }

    structuredLogger.logRoughMatch(start, end, bestScore, true);
    return Optional.of(
        new MatchWindow(song.sourcePath(), mix.sourcePath(), start, end, bestScore));
  }

  /** Every decoder resamples to the analysis rate, so a mismatch means mixed extractor settings. */
  static void checkCompatible(Fingerprint song, Fingerprint mix) {
    if (song.sampleRate() != mix.sampleRate() || song.hopLength() != mix.hopLength()) {
      throw new IllegalArgumentException(
          String.format(
              "Fingerprints use different frame grids: song %d Hz/hop %d, mix %d Hz/hop %d",
              song.sampleRate(), song.hopLength(), mix.sampleRate(), mix.hopLength()));
    }
  }

  static void checkBudget(int frames, int maxFrames) {
    if (frames > maxFrames) {
      throw new AnalysisTimeoutException(
          "Correlation over " + frames + " frames exceeds budget of " + maxFrames);
    }
  }
}
