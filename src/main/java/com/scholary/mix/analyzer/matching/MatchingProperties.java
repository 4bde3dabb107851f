package com.scholary.mix.analyzer.matching;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for locating songs in mixes.
 *
 * <p>{@code maxCorrelationFrames} bounds the mix frames a single cross-correlation may cover.
 */
@ConfigurationProperties(prefix = "matching")
@Validated
public record MatchingProperties(
    @Valid RoughProperties rough,
    @Valid IsometryProperties isometry,
    @Valid BeatProperties beat,
    @Positive int maxCorrelationFrames) {

  public record RoughProperties(double confidenceThreshold) {

    public static RoughProperties defaults() {
      return new RoughProperties(10000);
    }
  }

  public record IsometryProperties(
      @Positive int chunks,
      @Positive double chunkSeconds,
      @PositiveOrZero double bufferSeconds,
      @PositiveOrZero int toleranceFrames,
      double chunkConfidenceThreshold,
      double expansionThreshold,
      double refinementThreshold,
      @PositiveOrZero int minChunkFactor) {

    public static IsometryProperties defaults() {
      return new IsometryProperties(30, 5.0, 30.0, 100, 1000, 0.6, 0.8, 4);
    }
  }

  public record BeatProperties(
      @Positive double minBpm,
      @Positive double maxBpm,
      @Positive double startBpm,
      @Positive int beatsPerMeasure,
      @Positive double tightness,
      @Positive int maxFrames) {

    public static BeatProperties defaults() {
      return new BeatProperties(60, 200, 120, 4, 100, 400_000);
    }
  }

  public static MatchingProperties defaults() {
    return new MatchingProperties(
        RoughProperties.defaults(),
        IsometryProperties.defaults(),
        BeatProperties.defaults(),
        2_000_000);
  }
}
