package com.scholary.mix.analyzer.beat;

import com.scholary.mix.analyzer.audio.Waveform;
import com.scholary.mix.analyzer.beat.TempoEstimator.Tempo;
import com.scholary.mix.analyzer.dsp.ShortTimeFourierTransform;
import com.scholary.mix.analyzer.matching.AnalysisTimeoutException;
import com.scholary.mix.analyzer.matching.MatchingProperties.BeatProperties;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Dynamic-programming beat tracker (Ellis 2007).
 *
 * <p>The onset envelope is scaled to unit deviation and smoothed with a Gaussian one beat wide.
 * Every frame then gets the best cumulative score of a beat sequence ending there, where moving
 * from beat {@code j} to {@code i} costs {@code tightness * log((i - j) / period)^2}. The sequence
 * is backtracked from the last strong cumulative peak, and weak beats at either end are trimmed.
 */
public class BeatTracker {

  private final BeatProperties properties;
  private final int fftSize;
  private final int hopLength;
  private final TempoEstimator tempoEstimator;

  public BeatTracker(BeatProperties properties, int fftSize, int hopLength) {
    this.properties = properties;
    this.fftSize = fftSize;
    this.hopLength = hopLength;
    this.tempoEstimator =
        new TempoEstimator(properties.minBpm(), properties.maxBpm(), properties.startBpm());
  }

  /**
   * Track the beats of a recording.
   *
   * @param waveform mono audio
   * @return the beat grid, empty when no periodic onsets were found
   * @throws AnalysisTimeoutException if the recording has more frames than {@code maxFrames}
   */
  public BeatGrid track(Waveform waveform) {
    int frames = ShortTimeFourierTransform.frameCount(waveform.sampleCount(), hopLength);
    if (frames > properties.maxFrames()) {
      throw new AnalysisTimeoutException(
          "Beat tracking over " + frames + " frames exceeds budget of " + properties.maxFrames());
    }

    double frameSeconds = (double) hopLength / waveform.sampleRate();
    double[] onset = OnsetStrength.envelope(waveform, fftSize, hopLength);
    Tempo tempo = tempoEstimator.estimate(onset, frameSeconds);
    if (!tempo.isPresent()) {
      return BeatGrid.empty(properties.beatsPerMeasure());
    }

    int[] beats = trackBeats(onset, tempo.periodFrames());
    double[] times = new double[beats.length];
    for (int i = 0; i < beats.length; i++) {
      times[i] = beats[i] * frameSeconds;
    }
    return new BeatGrid(times, beats.length == 0 ? 0.0 : tempo.bpm(), properties.beatsPerMeasure());
  }

  /** Beat frames for an onset envelope and a beat period in frames. */
  int[] trackBeats(double[] onset, int period) {
    double deviation = standardDeviation(onset);
    if (deviation <= 0.0 || onset.length == 0) {
      return new int[0];
    }

    double[] local = localScore(onset, deviation, period);
    double maxLocal = Arrays.stream(local).max().orElse(0.0);
    if (maxLocal <= 0.0) {
      return new int[0];
    }

    int n = local.length;
    double[] cumulative = new double[n];
    int[] backlink = new int[n];
    double firstBeatThreshold = 0.01 * maxLocal;
    boolean firstBeat = true;

    for (int i = 0; i < n; i++) {
      int from = Math.max(0, i - 2 * period);
      int to = i - Math.max(1, Math.round(period / 2.0f));
      int best = -1;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int j = from; j <= to; j++) {
        double ratio = Math.log((double) (i - j) / period);
        double score = cumulative[j] - properties.tightness() * ratio * ratio;
        if (score > bestScore) {
          bestScore = score;
          best = j;
        }
      }

      if (best < 0 || (firstBeat && local[i] < firstBeatThreshold)) {
        cumulative[i] = local[i];
        backlink[i] = -1;
      } else {
        cumulative[i] = local[i] + bestScore;
        backlink[i] = best;
        firstBeat = false;
      }
    }

    int last = lastBeat(cumulative);
    if (last < 0) {
      return new int[0];
    }

    Deque<Integer> path = new ArrayDeque<>();
    for (int beat = last; beat >= 0; beat = backlink[beat]) {
      path.addFirst(beat);
    }
    return trim(path.stream().mapToInt(Integer::intValue).toArray(), local);
  }

  private static double[] localScore(double[] onset, double deviation, int period) {
    int radius = period;
    double[] window = new double[2 * radius + 1];
    for (int k = -radius; k <= radius; k++) {
      double x = k * 32.0 / radius;
      window[k + radius] = Math.exp(-0.5 * x * x);
    }

    double[] local = new double[onset.length];
    for (int i = 0; i < onset.length; i++) {
      double sum = 0.0;
      for (int k = -radius; k <= radius; k++) {
        int idx = i + k;
        if (idx >= 0 && idx < onset.length) {
          sum += onset[idx] / deviation * window[k + radius];
        }
      }
      local[i] = sum;
    }
    return local;
  }

  /** Last local peak of the cumulative score reaching half the median peak height. */
  private static int lastBeat(double[] cumulative) {
    int n = cumulative.length;
    List<Integer> peaks = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double left = i > 0 ? cumulative[i - 1] : Double.NEGATIVE_INFINITY;
      double right = i < n - 1 ? cumulative[i + 1] : Double.NEGATIVE_INFINITY;
      if (cumulative[i] > left && cumulative[i] >= right) {
        peaks.add(i);
      }
    }
    if (peaks.isEmpty()) {
      return -1;
    }

    double[] heights = peaks.stream().mapToDouble(p -> cumulative[p]).sorted().toArray();
    double median =
        heights.length % 2 == 1
            ? heights[heights.length / 2]
            : (heights[heights.length / 2 - 1] + heights[heights.length / 2]) / 2;
    double threshold = 0.5 * median;

    for (int i = peaks.size() - 1; i >= 0; i--) {
      if (cumulative[peaks.get(i)] >= threshold) {
        return peaks.get(i);
      }
    }
    return peaks.get(peaks.size() - 1);
  }

  /** Drop leading and trailing beats whose local score is under half the RMS over all beats. */
  private static int[] trim(int[] beats, double[] local) {
    if (beats.length == 0) {
      return beats;
    }
    double sumSquares = 0.0;
    for (int beat : beats) {
      sumSquares += local[beat] * local[beat];
    }
    double threshold = 0.5 * Math.sqrt(sumSquares / beats.length);

    int start = 0;
    while (start < beats.length && local[beats[start]] < threshold) {
      start++;
    }
    int end = beats.length;
    while (end > start && local[beats[end - 1]] < threshold) {
      end--;
    }
    return Arrays.copyOfRange(beats, start, end);
  }

  private static double standardDeviation(double[] values) {
    if (values.length < 2) {
      return 0.0;
    }
    double mean = Arrays.stream(values).average().orElse(0.0);
    double sum = 0.0;
    for (double v : values) {
      sum += (v - mean) * (v - mean);
    }
    return Math.sqrt(sum / (values.length - 1));
  }
}
