package com.scholary.mix.analyzer.beat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.mix.analyzer.beat.TempoEstimator.Tempo;
import org.junit.jupiter.api.Test;

class TempoEstimatorTest {

  private static final double FRAME_SECONDS = 512.0 / 22050;

  private final TempoEstimator estimator = new TempoEstimator(60, 200, 120);

  private static double[] impulses(int length, int first, int period) {
    double[] onset = new double[length];
    for (int i = first; i < length; i += period) {
      onset[i] = 1.0;
    }
    return onset;
  }

  @Test
  void estimate_shouldFindImpulsePeriod() {
    Tempo tempo = estimator.estimate(impulses(2000, 5, 21), FRAME_SECONDS);

    assertThat(tempo.isPresent()).isTrue();
    assertThat(tempo.periodFrames()).isEqualTo(21);
    assertThat(tempo.bpm()).isCloseTo(60.0 / (21 * FRAME_SECONDS), within(1e-9));
  }

  @Test
  void estimate_shouldLetPriorChooseBetweenTempoMultiples() {
    // impulses every 14 frames (~185 bpm) correlate equally at 28 frames (~92 bpm),
    // which is closer to 120 bpm in octaves
    Tempo tempo = estimator.estimate(impulses(3000, 0, 14), FRAME_SECONDS);

    assertThat(tempo.periodFrames()).isEqualTo(28);
  }

  @Test
  void estimate_shouldReturnNoneForSilence() {
    assertThat(estimator.estimate(new double[1000], FRAME_SECONDS)).isEqualTo(Tempo.NONE);
  }

  @Test
  void estimate_shouldReturnNoneWhenEnvelopeShorterThanShortestPeriod() {
    assertThat(estimator.estimate(impulses(5, 0, 2), FRAME_SECONDS).isPresent()).isFalse();
  }

  @Test
  void constructor_shouldRejectInvertedRange() {
    assertThatThrownBy(() -> new TempoEstimator(200, 60, 120))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
