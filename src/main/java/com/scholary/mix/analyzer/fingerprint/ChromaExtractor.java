package com.scholary.mix.analyzer.fingerprint;

import com.scholary.mix.analyzer.audio.Waveform;
import com.scholary.mix.analyzer.dsp.ShortTimeFourierTransform;

/**
 * Computes a 12-bin chroma matrix from a waveform.
 *
 * <p>Each STFT bin above {@code minFrequency} contributes its power to the pitch class of the
 * nearest equal-tempered MIDI note (A4 = 440 Hz). Every frame is then scaled so its largest bin is
 * 1; frames with no energy stay at zero.
 */
public class ChromaExtractor {

  private static final double TINY = 1e-20;

  private final int fftSize;
  private final int hopLength;
  private final double minFrequency;

  public ChromaExtractor(int fftSize, int hopLength, double minFrequency) {
    this.fftSize = fftSize;
    this.hopLength = hopLength;
    this.minFrequency = minFrequency;
  }

  public Fingerprint extract(Waveform waveform, String sourcePath) {
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(fftSize, hopLength);
    int[] pitchClassOfBin = pitchClassMap(stft, waveform.sampleRate());
    int frames = ShortTimeFourierTransform.frameCount(waveform.sampleCount(), hopLength);
    double[][] chroma = new double[Fingerprint.PITCH_CLASSES][frames];

    stft.transform(
        waveform.samples(),
        (frame, magnitudes) -> {
          for (int bin = 0; bin < magnitudes.length; bin++) {
            int pc = pitchClassOfBin[bin];
            if (pc >= 0) {
              chroma[pc][frame] += magnitudes[bin] * magnitudes[bin];
            }
          }
        });

    for (int t = 0; t < frames; t++) {
      double max = 0.0;
      for (int pc = 0; pc < Fingerprint.PITCH_CLASSES; pc++) {
        max = Math.max(max, chroma[pc][t]);
      }
      if (max > TINY) {
        for (int pc = 0; pc < Fingerprint.PITCH_CLASSES; pc++) {
          chroma[pc][t] /= max;
        }
      }
    }

    return new Fingerprint(chroma, waveform.sampleRate(), hopLength, sourcePath);
  }

  /** Pitch class (C = 0) for each bin, or -1 for bins ignored (DC, below minFrequency). */
  int[] pitchClassMap(ShortTimeFourierTransform stft, int sampleRate) {
    int[] map = new int[stft.binCount()];
    for (int bin = 0; bin < map.length; bin++) {
      double frequency = stft.binFrequency(bin, sampleRate);
      map[bin] = frequency < minFrequency || frequency <= 0 ? -1 : pitchClass(frequency);
    }
    return map;
  }

  static int pitchClass(double frequency) {
    long midi = Math.round(69 + 12 * (Math.log(frequency / 440.0) / Math.log(2)));
    return (int) Math.floorMod(midi, 12L);
  }
}
