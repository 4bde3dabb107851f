package com.scholary.mix.analyzer.audio;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Sends WAV files to the in-process decoder and everything else to ffmpeg.
 *
 * <p>Routing is by file extension only ({@code .wav}, {@code .wave}, any case).
 */
public class RoutingAudioDecoder implements AudioDecoder {

  private final AudioDecoder wavDecoder;
  private final AudioDecoder fallbackDecoder;

  public RoutingAudioDecoder(AudioDecoder wavDecoder, AudioDecoder fallbackDecoder) {
    this.wavDecoder = wavDecoder;
    this.fallbackDecoder = fallbackDecoder;
  }

  @Override
  public Waveform decode(Path audioFile) {
    return select(audioFile).decode(audioFile);
  }

  @Override
  public String settingsTag() {
    return wavDecoder.settingsTag() + "+" + fallbackDecoder.settingsTag();
  }

  AudioDecoder select(Path audioFile) {
    String name = audioFile.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".wav") || name.endsWith(".wave") ? wavDecoder : fallbackDecoder;
  }
}
