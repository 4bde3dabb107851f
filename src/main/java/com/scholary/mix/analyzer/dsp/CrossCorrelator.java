package com.scholary.mix.analyzer.dsp;

import java.util.Arrays;
import org.jtransforms.fft.DoubleFFT_1D;

/**
 * Multi-channel correlation helpers for feature matrices laid out as {@code [channel][frame]}.
 *
 * <p>The central operation is a "valid" cross-correlation of a long matrix (the haystack, usually
 * a mix) against a shorter one (the needle, a song or a chunk of one), summed over channels:
 *
 * <pre>
 * score[k] = sum over c, t of haystack[c][k + t] * needle[c][t],   0 <= k <= H - N
 * </pre>
 *
 * <p>Computed in the frequency domain: one forward FFT per channel and matrix, the products are
 * accumulated across channels, and a single inverse FFT yields every lag at once.
 */
public final class CrossCorrelator {

  private static final double EPSILON = 1e-8;

  private CrossCorrelator() {}

  /**
   * Shift and scale the whole matrix to zero mean and unit variance.
   *
   * <p>Statistics are taken over every cell, not per channel. The epsilon keeps silent (constant)
   * input from dividing by zero.
   */
  public static double[][] normalize(double[][] matrix) {
    long count = 0;
    double sum = 0.0;
    for (double[] row : matrix) {
      for (double v : row) {
        sum += v;
      }
      count += row.length;
    }
    if (count == 0) {
      return new double[matrix.length][0];
    }
    double mean = sum / count;

    double squares = 0.0;
    for (double[] row : matrix) {
      for (double v : row) {
        double d = v - mean;
        squares += d * d;
      }
    }
    double std = Math.sqrt(squares / count) + EPSILON;

    double[][] normalized = new double[matrix.length][];
    for (int c = 0; c < matrix.length; c++) {
      double[] row = matrix[c];
      double[] out = new double[row.length];
      for (int t = 0; t < row.length; t++) {
        out[t] = (row[t] - mean) / std;
      }
      normalized[c] = out;
    }
    return normalized;
  }

  /**
   * Valid-mode cross-correlation summed over channels.
   *
   * @param haystack matrix searched in, {@code [channels][H]}
   * @param needle matrix searched for, {@code [channels][N]}
   * @return {@code H - N + 1} scores, or an empty array if the needle is empty or longer than the
   *     haystack
   */
  public static double[] correlateValid(double[][] haystack, double[][] needle) {
    if (haystack.length != needle.length) {
      throw new IllegalArgumentException(
          "Channel count mismatch: " + haystack.length + " vs " + needle.length);
    }
    if (haystack.length == 0) {
      return new double[0];
    }
    int h = haystack[0].length;
    int n = needle[0].length;
    if (n == 0 || n > h) {
      return new double[0];
    }

    int required = h + n - 1;
    int size = 2;
    while (size < required) {
      size <<= 1;
    }
    DoubleFFT_1D fft = new DoubleFFT_1D(size);

    double[] accumulated = new double[2 * size];
    double[] a = new double[2 * size];
    double[] b = new double[2 * size];

    for (int c = 0; c < haystack.length; c++) {
      Arrays.fill(a, 0.0);
      Arrays.fill(b, 0.0);
      System.arraycopy(haystack[c], 0, a, 0, h);
      System.arraycopy(needle[c], 0, b, 0, n);
      fft.realForwardFull(a);
      fft.realForwardFull(b);

      // accumulated += A * conj(B)
      for (int k = 0; k < size; k++) {
        double ar = a[2 * k];
        double ai = a[2 * k + 1];
        double br = b[2 * k];
        double bi = b[2 * k + 1];
        accumulated[2 * k] += ar * br + ai * bi;
        accumulated[2 * k + 1] += ai * br - ar * bi;
      }
    }

    fft.complexInverse(accumulated, true);

    double[] scores = new double[h - n + 1];
    for (int k = 0; k < scores.length; k++) {
      scores[k] = accumulated[2 * k];
    }
    return scores;
  }

  /** Index of the largest value; the first one wins on ties. Returns -1 for an empty array. */
  public static int argMax(double[] values) {
    int best = -1;
    double bestValue = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < values.length; i++) {
      if (values[i] > bestValue) {
        bestValue = values[i];
        best = i;
      }
    }
    return best;
  }

  /**
   * Cosine similarity between two equally long frame ranges, flattened across channels.
   *
   * @return similarity in [-1, 1], or -1 if either range falls outside its matrix
   */
  public static double cosineSimilarity(
      double[][] a, int aStart, double[][] b, int bStart, int length) {
    if (length <= 0 || aStart < 0 || bStart < 0) {
      return -1.0;
    }
    if (aStart + length > frames(a) || bStart + length > frames(b)) {
      return -1.0;
    }

    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int c = 0; c < a.length; c++) {
      double[] rowA = a[c];
      double[] rowB = b[c];
      for (int t = 0; t < length; t++) {
        double va = rowA[aStart + t];
        double vb = rowB[bStart + t];
        dot += va * vb;
        normA += va * va;
        normB += vb * vb;
      }
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB) + EPSILON);
  }

  /** Copy of frames {@code [from, to)} of every channel. */
  public static double[][] slice(double[][] matrix, int from, int to) {
    double[][] out = new double[matrix.length][];
    for (int c = 0; c < matrix.length; c++) {
      out[c] = Arrays.copyOfRange(matrix[c], from, to);
    }
    return out;
  }

  public static int frames(double[][] matrix) {
    return matrix.length == 0 ? 0 : matrix[0].length;
  }
}
