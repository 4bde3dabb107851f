package com.scholary.mix.analyzer.fingerprint;

/**
 * Chroma fingerprint of one audio file.
 *
 * <p>{@code features[pitchClass][frame]} holds the normalized energy of each of the 12 pitch
 * classes (C = 0 ... B = 11) per STFT frame. Frame {@code t} is centred on time {@code t *
 * hopLength / sampleRate}, and there are {@code ceil(samples / hopLength)} frames.
 *
 * <p>Treat the matrix as immutable once computed; it is shared through the cache.
 */
public record Fingerprint(double[][] features, int sampleRate, int hopLength, String sourcePath) {

  public static final int PITCH_CLASSES = 12;

  public Fingerprint {
    if (features.length != PITCH_CLASSES) {
      throw new IllegalArgumentException(
          "Expected " + PITCH_CLASSES + " chroma rows, got " + features.length);
    }
    if (sampleRate <= 0 || hopLength <= 0) {
      throw new IllegalArgumentException("Sample rate and hop length must be positive");
    }
  }

  public int frameCount() {
    return features[0].length;
  }

  public double framesToSeconds(int frames) {
    return (double) frames * hopLength / sampleRate;
  }

  /** Seconds to the frame containing that instant (floor). */
  public int secondsToFrames(double seconds) {
    return (int) Math.floor(seconds * sampleRate / hopLength);
  }

  public double durationSeconds() {
    return framesToSeconds(frameCount());
  }

  /** Duration of one frame step, the time resolution of anything derived from this matrix. */
  public double frameSeconds() {
    return (double) hopLength / sampleRate;
  }

  public Fingerprint withSourcePath(String path) {
    return new Fingerprint(features, sampleRate, hopLength, path);
  }
}
