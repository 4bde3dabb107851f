package com.scholary.mix.analyzer.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.mix.analyzer.support.AudioFixtures;
import org.junit.jupiter.api.Test;

class ChromaExtractorTest {

  private final ChromaExtractor extractor =
      new ChromaExtractor(AudioFixtures.FFT_SIZE, AudioFixtures.HOP_LENGTH, 32.7);

  @Test
  void pitchClass_shouldMapToNearestNote() {
    assertThat(ChromaExtractor.pitchClass(440.0)).isEqualTo(9);
    assertThat(ChromaExtractor.pitchClass(261.63)).isZero();
    assertThat(ChromaExtractor.pitchClass(277.18)).isEqualTo(1);
    assertThat(ChromaExtractor.pitchClass(493.88)).isEqualTo(11);
    // 23 cents sharp still rounds to A
    assertThat(ChromaExtractor.pitchClass(446.0)).isEqualTo(9);
  }

  @Test
  void extract_shouldPutSineEnergyInItsPitchClass() {
    Fingerprint fingerprint =
        extractor.extract(AudioFixtures.waveform(AudioFixtures.sine(440.0, 1.0)), "a4.wav");

    int middle = fingerprint.frameCount() / 2;
    assertThat(fingerprint.features()[9][middle]).isEqualTo(1.0);
    for (int pc = 0; pc < Fingerprint.PITCH_CLASSES; pc++) {
      if (pc != 9) {
        assertThat(fingerprint.features()[pc][middle]).isLessThan(0.2);
      }
    }
  }

  @Test
  void extract_shouldProduceCeilFrameCount() {
    float[] samples = new float[AudioFixtures.HOP_LENGTH * 10 + 1];

    Fingerprint fingerprint = extractor.extract(AudioFixtures.waveform(samples), "x.wav");

    assertThat(fingerprint.frameCount()).isEqualTo(11);
    assertThat(fingerprint.durationSeconds())
        .isCloseTo(11.0 * AudioFixtures.HOP_LENGTH / AudioFixtures.SAMPLE_RATE, within(1e-12));
  }

  @Test
  void extract_shouldLeaveSilentFramesAtZero() {
    Fingerprint fingerprint =
        extractor.extract(AudioFixtures.waveform(AudioFixtures.silence(22050)), "silence.wav");

    for (double[] row : fingerprint.features()) {
      assertThat(row).containsOnly(0.0);
    }
  }

  @Test
  void secondsToFrames_shouldFloor() {
    Fingerprint fingerprint =
        new Fingerprint(
            new double[12][100], AudioFixtures.SAMPLE_RATE, AudioFixtures.HOP_LENGTH, "x");

    double frameSeconds = fingerprint.frameSeconds();
    assertThat(fingerprint.secondsToFrames(3 * frameSeconds + 1e-6)).isEqualTo(3);
    assertThat(fingerprint.secondsToFrames(3.99 * frameSeconds)).isEqualTo(3);
  }
}
