package com.scholary.mix.analyzer.dsp;

import org.jtransforms.fft.DoubleFFT_1D;

/**
 * Streaming short-time Fourier transform over a mono waveform.
 *
 * <p>Frames are centred: frame {@code t} covers samples {@code [t*hop - n/2, t*hop + n/2)}, zero
 * padded outside the signal, windowed with a periodic Hann window. The number of frames is {@code
 * ceil(samples / hop)}, so frame {@code t} always corresponds to time {@code t * hop / sr}.
 *
 * <p>Spectra are handed to a {@link FrameConsumer} one at a time instead of being collected, since
 * a full spectrogram of a long mix does not fit in memory. Instances are not thread-safe; the FFT
 * scratch buffers are reused between frames.
 */
public class ShortTimeFourierTransform {

  /** Receives the magnitude spectrum of one frame. The array is reused after the call returns. */
  @FunctionalInterface
  public interface FrameConsumer {
    void accept(int frameIndex, double[] magnitudes);
  }

  private final int fftSize;
  private final int hopLength;
  private final double[] window;
  private final DoubleFFT_1D fft;
  private final double[] buffer;
  private final double[] magnitudes;

  public ShortTimeFourierTransform(int fftSize, int hopLength) {
    if (fftSize <= 0 || fftSize % 2 != 0) {
      throw new IllegalArgumentException("FFT size must be a positive even number");
    }
    if (hopLength <= 0) {
      throw new IllegalArgumentException("Hop length must be positive");
    }
    this.fftSize = fftSize;
    this.hopLength = hopLength;
    this.window = hann(fftSize);
    this.fft = new DoubleFFT_1D(fftSize);
    this.buffer = new double[fftSize];
    this.magnitudes = new double[fftSize / 2 + 1];
  }

  public static int frameCount(int sampleCount, int hopLength) {
    return (sampleCount + hopLength - 1) / hopLength;
  }

  public int binCount() {
    return fftSize / 2 + 1;
  }

  public int hopLength() {
    return hopLength;
  }

  public double binFrequency(int bin, int sampleRate) {
    return (double) bin * sampleRate / fftSize;
  }

  /**
   * Run the transform and feed every frame's magnitude spectrum to the consumer.
   *
   * @param samples mono samples
   * @param consumer receives each frame in order
   * @return number of frames produced
   */
  public int transform(float[] samples, FrameConsumer consumer) {
    int frames = frameCount(samples.length, hopLength);
    int half = fftSize / 2;

    for (int frame = 0; frame < frames; frame++) {
      int start = frame * hopLength - half;
      for (int i = 0; i < fftSize; i++) {
        int idx = start + i;
        buffer[i] = idx >= 0 && idx < samples.length ? samples[idx] * window[i] : 0.0;
      }

      fft.realForward(buffer);

      // Packed layout: [Re0, Re(n/2), Re1, Im1, Re2, Im2, ...]
      magnitudes[0] = Math.abs(buffer[0]);
      magnitudes[half] = Math.abs(buffer[1]);
      for (int k = 1; k < half; k++) {
        double re = buffer[2 * k];
        double im = buffer[2 * k + 1];
        magnitudes[k] = Math.sqrt(re * re + im * im);
      }

      consumer.accept(frame, magnitudes);
    }
    return frames;
  }

  private static double[] hann(int size) {
    double[] w = new double[size];
    for (int i = 0; i < size; i++) {
      w[i] = 0.5 - 0.5 * Math.cos(2 * Math.PI * i / size);
    }
    return w;
  }
}
