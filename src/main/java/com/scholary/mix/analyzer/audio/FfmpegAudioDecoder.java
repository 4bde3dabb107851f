package com.scholary.mix.analyzer.audio;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes any container ffmpeg understands (mp3, m4a, webm, ...) into mono float PCM.
 *
 * <p>We ask ffmpeg to downmix and resample, and to write raw 32-bit little-endian floats to
 * stdout:
 *
 * <pre>
 * ffmpeg -v error -nostdin -i input.mp3 -f f32le -ac 1 -ar 22050 -
 * </pre>
 *
 * <p>The whole stream is buffered in memory: a one hour mix at 22050 Hz is about 320 MB of floats.
 */
public class FfmpegAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioDecoder.class);

  private final FfmpegProperties properties;

  public FfmpegAudioDecoder(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public Waveform decode(Path audioFile) {
    if (!Files.isRegularFile(audioFile)) {
      throw new MissingInputException(audioFile);
    }

    List<String> command =
        List.of(
            properties.binary(),
            "-v",
            "error",
            "-nostdin",
            "-i",
            audioFile.toString(),
            "-f",
            "f32le",
            "-ac",
            "1",
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-");

    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process =
          new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
    } catch (IOException e) {
      throw new AudioDecodeException("Failed to start ffmpeg for " + audioFile, e);
    }

    CompletableFuture<byte[]> output = CompletableFuture.supplyAsync(() -> readOutput(process));
    try {
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        output.cancel(true);
        throw new AudioDecodeException(
            "ffmpeg timed out after " + properties.timeoutSeconds() + "s decoding " + audioFile);
      }

      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new AudioDecodeException(
            "ffmpeg exited with code " + exitCode + " while decoding " + audioFile);
      }

      byte[] raw = output.get(properties.timeoutSeconds(), TimeUnit.SECONDS);
      float[] samples = toFloats(raw);
      if (samples.length == 0) {
        throw new AudioDecodeException("ffmpeg produced no audio for " + audioFile);
      }

      LOGGER.info(
          "Decoded {}: {} samples ({}s at {} Hz)",
          audioFile.getFileName(),
          samples.length,
          String.format("%.1f", (double) samples.length / properties.sampleRate()),
          properties.sampleRate());
      return new Waveform(samples, properties.sampleRate());

    } catch (ExecutionException e) {
      throw new AudioDecodeException("Failed to read ffmpeg output for " + audioFile, e.getCause());
    } catch (TimeoutException e) {
      throw new AudioDecodeException("ffmpeg output for " + audioFile + " was never closed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      output.cancel(true);
      throw new AudioDecodeException("Decoding interrupted: " + audioFile, e);
    }
  }

  /** Runs on its own thread so that the process timeout starts with the process. */
  private static byte[] readOutput(Process process) {
    try (InputStream stdout = process.getInputStream()) {
      return stdout.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public String settingsTag() {
    return "ffmpeg-" + properties.sampleRate();
  }

  static float[] toFloats(byte[] raw) {
    FloatBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
    float[] samples = new float[buffer.remaining()];
    buffer.get(samples);
    return samples;
  }
}
