package com.scholary.mix.analyzer.beat;

/**
 * Estimates tempo from the autocorrelation of an onset envelope.
 *
 * <p>Only lags between {@code 60 / maxBpm} and {@code 60 / minBpm} seconds are considered. Each
 * lag's autocorrelation is weighted by a log-normal prior centred on {@code startBpm} with a
 * standard deviation of one octave, so half- and double-tempo peaks lose to the expected one.
 */
public class TempoEstimator {

  /**
   * Estimated tempo.
   *
   * @param bpm beats per minute, 0 when nothing periodic was found
   * @param periodFrames beat period in frames, 0 when nothing periodic was found
   */
  public record Tempo(double bpm, int periodFrames) {

    public static final Tempo NONE = new Tempo(0.0, 0);

    public boolean isPresent() {
      return periodFrames > 0;
    }
  }

  private final double minBpm;
  private final double maxBpm;
  private final double startBpm;

  public TempoEstimator(double minBpm, double maxBpm, double startBpm) {
    if (minBpm >= maxBpm) {
      throw new IllegalArgumentException("minBpm must be below maxBpm");
    }
    this.minBpm = minBpm;
    this.maxBpm = maxBpm;
    this.startBpm = startBpm;
  }

  public Tempo estimate(double[] onset, double frameSeconds) {
    int n = onset.length;
    int minLag = Math.max(1, (int) Math.floor(60.0 / maxBpm / frameSeconds));
    int maxLag = Math.min(n - 1, (int) Math.ceil(60.0 / minBpm / frameSeconds));
    if (minLag > maxLag) {
      return Tempo.NONE;
    }

    int bestLag = 0;
    double bestScore = 0.0;
    for (int lag = minLag; lag <= maxLag; lag++) {
      double sum = 0.0;
      for (int i = 0; i + lag < n; i++) {
        sum += onset[i] * onset[i + lag];
      }
      double autocorrelation = sum / (n - lag);
      double bpm = 60.0 / (lag * frameSeconds);
      double octaves = Math.log(bpm / startBpm) / Math.log(2);
      double score = autocorrelation * Math.exp(-0.5 * octaves * octaves);
      if (score > bestScore) {
        bestScore = score;
        bestLag = lag;
      }
    }

    if (bestLag == 0) {
      return Tempo.NONE;
    }
    return new Tempo(60.0 / (bestLag * frameSeconds), bestLag);
  }
}
