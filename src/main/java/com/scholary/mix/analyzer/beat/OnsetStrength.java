package com.scholary.mix.analyzer.beat;

import com.scholary.mix.analyzer.audio.Waveform;
import com.scholary.mix.analyzer.dsp.ShortTimeFourierTransform;

/**
 * Onset-strength envelope: half-wave rectified spectral flux of the log-compressed STFT
 * magnitude, one value per frame on the same grid as the chroma fingerprint.
 */
public final class OnsetStrength {

  private OnsetStrength() {}

  /**
   * Compute the envelope.
   *
   * @param waveform mono audio
   * @param fftSize STFT size
   * @param hopLength STFT hop
   * @return one non-negative value per frame; frame 0 is always 0
   */
  public static double[] envelope(Waveform waveform, int fftSize, int hopLength) {
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(fftSize, hopLength);
    double[] envelope =
        new double[ShortTimeFourierTransform.frameCount(waveform.sampleCount(), hopLength)];
    double[] previous = new double[stft.binCount()];

    stft.transform(
        waveform.samples(),
        (frame, magnitudes) -> {
          double flux = 0.0;
          for (int bin = 0; bin < magnitudes.length; bin++) {
            double compressed = Math.log1p(magnitudes[bin]);
            if (frame > 0) {
              flux += Math.max(0.0, compressed - previous[bin]);
            }
            previous[bin] = compressed;
          }
          envelope[frame] = flux;
        });
    return envelope;
  }
}
