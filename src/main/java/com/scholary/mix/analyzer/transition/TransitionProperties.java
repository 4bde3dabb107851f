package com.scholary.mix.analyzer.transition;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transition pairing and path selection.
 *
 * <p>A pair is kept when {@code minGapSeconds < gap < maxGapSeconds}, both bounds exclusive.
 */
@ConfigurationProperties(prefix = "transitions")
@Validated
public record TransitionProperties(
    @PositiveOrZero double minGapSeconds,
    @Positive double maxGapSeconds,
    @PositiveOrZero double crossfadeSeconds,
    @NotNull SelectorType selector,
    @Positive int beamWidth,
    @Positive long exhaustiveExpansionLimit) {

  /** Which path selector the planner uses. */
  public enum SelectorType {
    BEAM,
    EXHAUSTIVE
  }

  public static TransitionProperties defaults() {
    return new TransitionProperties(5.0, 45.0, 5.0, SelectorType.BEAM, 3, 10_000_000L);
  }
}
