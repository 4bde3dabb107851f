package com.scholary.mix.analyzer.dsp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ShortTimeFourierTransformTest {

  @Test
  void frameCount_shouldRoundUp() {
    assertThat(ShortTimeFourierTransform.frameCount(1024, 512)).isEqualTo(2);
    assertThat(ShortTimeFourierTransform.frameCount(1025, 512)).isEqualTo(3);
    assertThat(ShortTimeFourierTransform.frameCount(0, 512)).isZero();
  }

  @Test
  void transform_shouldPeakAtSineFrequency() {
    int sampleRate = 8000;
    int fftSize = 256;
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(fftSize, 128);
    // bin 16 of a 256-point FFT at 8 kHz is exactly 500 Hz
    float[] samples = new float[2048];
    for (int n = 0; n < samples.length; n++) {
      samples[n] = (float) Math.sin(2 * Math.PI * 500.0 * n / sampleRate);
    }

    List<Integer> peaks = new ArrayList<>();
    int frames =
        stft.transform(
            samples,
            (frame, magnitudes) -> {
              int peak = 0;
              for (int bin = 1; bin < magnitudes.length; bin++) {
                if (magnitudes[bin] > magnitudes[peak]) {
                  peak = bin;
                }
              }
              peaks.add(peak);
            });

    assertThat(frames).isEqualTo(16);
    assertThat(stft.binFrequency(16, sampleRate)).isEqualTo(500.0);
    // frames away from the zero-padded edges see the full tone
    assertThat(peaks.subList(2, 14)).containsOnly(16);
  }

  @Test
  void transform_shouldGiveZeroSpectrumForSilence() {
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(64, 16);
    double[] maxMagnitude = {0.0};

    stft.transform(
        new float[100],
        (frame, magnitudes) -> {
          for (double m : magnitudes) {
            maxMagnitude[0] = Math.max(maxMagnitude[0], m);
          }
        });

    assertThat(maxMagnitude[0]).isZero();
  }

  @Test
  void constructor_shouldRejectOddFftSize() {
    assertThatThrownBy(() -> new ShortTimeFourierTransform(255, 128))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
