package com.scholary.mix.analyzer.audio;

/**
 * Decoded mono PCM audio.
 *
 * <p>Samples are normalized to [-1, 1]. Multi-channel sources are averaged down to a single
 * channel by the decoder before they get here.
 */
public record Waveform(float[] samples, int sampleRate) {

  public Waveform {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive");
    }
  }

  public int sampleCount() {
    return samples.length;
  }

  public double durationSeconds() {
    return (double) samples.length / sampleRate;
  }
}
