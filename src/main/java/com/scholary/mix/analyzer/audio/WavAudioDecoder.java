package com.scholary.mix.analyzer.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes WAV (and other formats javax.sound understands natively) without spawning a process.
 *
 * <p>The source is converted to signed 16-bit little-endian PCM at its native sample rate, the
 * channels are averaged into one, and the result is resampled to the analysis rate. Every file
 * therefore ends up on the same frame grid as the ffmpeg decoder's output.
 */
public class WavAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(WavAudioDecoder.class);

  private static final int BYTES_PER_SAMPLE = 2;

  private final int targetSampleRate;

  public WavAudioDecoder(int targetSampleRate) {
    if (targetSampleRate <= 0) {
      throw new IllegalArgumentException("Target sample rate must be positive");
    }
    this.targetSampleRate = targetSampleRate;
  }

  @Override
  public Waveform decode(Path audioFile) {
    if (!Files.isRegularFile(audioFile)) {
      throw new MissingInputException(audioFile);
    }

    try (AudioInputStream source = AudioSystem.getAudioInputStream(audioFile.toFile())) {
      AudioFormat sourceFormat = source.getFormat();
      AudioFormat pcmFormat =
          new AudioFormat(
              AudioFormat.Encoding.PCM_SIGNED,
              sourceFormat.getSampleRate(),
              BYTES_PER_SAMPLE * 8,
              sourceFormat.getChannels(),
              sourceFormat.getChannels() * BYTES_PER_SAMPLE,
              sourceFormat.getSampleRate(),
              false);

      try (AudioInputStream pcm = AudioSystem.getAudioInputStream(pcmFormat, source)) {
        byte[] bytes = readAll(pcm);
        int nativeRate = Math.round(pcmFormat.getSampleRate());
        float[] samples =
            resample(toMono(bytes, pcmFormat.getChannels()), nativeRate, targetSampleRate);

        LOGGER.debug(
            "Decoded {}: {} samples at {} Hz (native {} Hz, {} channels)",
            audioFile.getFileName(),
            samples.length,
            targetSampleRate,
            nativeRate,
            pcmFormat.getChannels());
        return new Waveform(samples, targetSampleRate);
      }
    } catch (UnsupportedAudioFileException | IllegalArgumentException e) {
      throw new AudioDecodeException("Unsupported audio file: " + audioFile, e);
    } catch (IOException e) {
      throw new AudioDecodeException("Failed to read audio file: " + audioFile, e);
    }
  }

  @Override
  public String settingsTag() {
    return "wav-" + targetSampleRate;
  }

  private static byte[] readAll(AudioInputStream stream) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    int read;
    while ((read = stream.read(buffer)) != -1) {
      out.write(buffer, 0, read);
    }
    return out.toByteArray();
  }

  /** Interleaved little-endian 16-bit PCM to averaged mono floats. */
  static float[] toMono(byte[] bytes, int channels) {
    int frameSize = channels * BYTES_PER_SAMPLE;
    int frames = bytes.length / frameSize;
    float[] samples = new float[frames];

    for (int frame = 0; frame < frames; frame++) {
      float sum = 0f;
      for (int channel = 0; channel < channels; channel++) {
        int offset = frame * frameSize + channel * BYTES_PER_SAMPLE;
        int value = (bytes[offset] & 0xff) | (bytes[offset + 1] << 8);
        sum += value / 32768f;
      }
      samples[frame] = sum / channels;
    }
    return samples;
  }

  /**
   * Linear-interpolation resampling. Downsampling first applies a centred moving average spanning
   * one output period.
   */
  static float[] resample(float[] samples, int sourceRate, int targetRate) {
    if (sourceRate == targetRate || samples.length == 0) {
      return samples;
    }
    double ratio = (double) sourceRate / targetRate;
    float[] input = ratio > 1.0 ? movingAverage(samples, 2 * (int) (ratio / 2) + 1) : samples;
    int length = (int) Math.round(samples.length / ratio);
    float[] result = new float[length];

    int last = input.length - 1;
    for (int i = 0; i < length; i++) {
      double position = i * ratio;
      int index = Math.min((int) position, last);
      int next = Math.min(index + 1, last);
      double frac = position - index;
      result[i] = (float) (input[index] + frac * (input[next] - input[index]));
    }
    return result;
  }

  private static float[] movingAverage(float[] samples, int width) {
    if (width <= 1) {
      return samples;
    }
    double[] prefix = new double[samples.length + 1];
    for (int i = 0; i < samples.length; i++) {
      prefix[i + 1] = prefix[i] + samples[i];
    }
    int half = width / 2;
    float[] out = new float[samples.length];
    for (int i = 0; i < samples.length; i++) {
      int from = Math.max(0, i - half);
      int to = Math.min(samples.length, i + half + 1);
      out[i] = (float) ((prefix[to] - prefix[from]) / (to - from));
    }
    return out;
  }
}
