package com.scholary.mix.analyzer.dsp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.junit.jupiter.api.Test;

class CrossCorrelatorTest {

  @Test
  void correlateValid_shouldMatchDirectSum() {
    Random random = new Random(42);
    double[][] haystack = randomMatrix(random, 3, 57);
    double[][] needle = randomMatrix(random, 3, 11);

    double[] scores = CrossCorrelator.correlateValid(haystack, needle);

    assertThat(scores).hasSize(57 - 11 + 1);
    for (int k = 0; k < scores.length; k++) {
      double expected = 0.0;
      for (int c = 0; c < 3; c++) {
        for (int t = 0; t < 11; t++) {
          expected += haystack[c][k + t] * needle[c][t];
        }
      }
      assertThat(scores[k]).isCloseTo(expected, within(1e-9));
    }
  }

  @Test
  void correlateValid_shouldFindEmbeddedPattern() {
    Random random = new Random(3);
    double[][] needle = CrossCorrelator.normalize(randomMatrix(random, 12, 40));
    double[][] haystack = new double[12][200];
    for (int c = 0; c < 12; c++) {
      System.arraycopy(needle[c], 0, haystack[c], 73, 40);
    }

    double[] scores = CrossCorrelator.correlateValid(haystack, needle);

    assertThat(CrossCorrelator.argMax(scores)).isEqualTo(73);
  }

  @Test
  void correlateValid_shouldReturnEmptyWhenNeedleIsLonger() {
    assertThat(CrossCorrelator.correlateValid(new double[2][5], new double[2][6])).isEmpty();
    assertThat(CrossCorrelator.correlateValid(new double[2][5], new double[2][0])).isEmpty();
  }

  @Test
  void correlateValid_shouldRejectChannelMismatch() {
    assertThatThrownBy(() -> CrossCorrelator.correlateValid(new double[2][5], new double[3][2]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Channel count mismatch");
  }

  @Test
  void normalize_shouldUseWholeMatrixStatistics() {
    double[][] matrix = {{1, 2}, {3, 4}};

    double[][] normalized = CrossCorrelator.normalize(matrix);

    // mean 2.5, population std sqrt(1.25)
    double std = Math.sqrt(1.25);
    assertThat(normalized[0][0]).isCloseTo(-1.5 / std, within(1e-6));
    assertThat(normalized[1][1]).isCloseTo(1.5 / std, within(1e-6));
  }

  @Test
  void normalize_shouldLeaveConstantInputFinite() {
    double[][] normalized = CrossCorrelator.normalize(new double[][] {{0, 0, 0}});

    assertThat(normalized[0]).containsExactly(0.0, 0.0, 0.0);
  }

  @Test
  void argMax_shouldPreferFirstOfEqualValues() {
    assertThat(CrossCorrelator.argMax(new double[] {1, 5, 5, 2})).isEqualTo(1);
    assertThat(CrossCorrelator.argMax(new double[0])).isEqualTo(-1);
  }

  @Test
  void cosineSimilarity_shouldReturnMinusOneOutOfBounds() {
    double[][] a = {{1, 2, 3, 4}};
    double[][] b = {{1, 2, 3, 4}};

    assertThat(CrossCorrelator.cosineSimilarity(a, 0, b, 0, 4)).isCloseTo(1.0, within(1e-6));
    assertThat(CrossCorrelator.cosineSimilarity(a, -1, b, 0, 2)).isEqualTo(-1.0);
    assertThat(CrossCorrelator.cosineSimilarity(a, 2, b, 0, 3)).isEqualTo(-1.0);
  }

  @Test
  void cosineSimilarity_shouldBeZeroForSilence() {
    double[][] silent = new double[2][4];
    double[][] other = {{1, 1, 1, 1}, {0, 0, 0, 0}};

    assertThat(CrossCorrelator.cosineSimilarity(silent, 0, other, 0, 4)).isEqualTo(0.0);
  }

  private static double[][] randomMatrix(Random random, int channels, int frames) {
    double[][] matrix = new double[channels][frames];
    for (int c = 0; c < channels; c++) {
      for (int t = 0; t < frames; t++) {
        matrix[c][t] = random.nextDouble();
      }
    }
    return matrix;
  }
}
