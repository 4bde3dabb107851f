package com.scholary.mix.analyzer.audio;

import java.nio.file.Path;

/**
 * Turns an audio file into a mono waveform.
 *
 * <p>Implementations throw {@link MissingInputException} when the file does not exist and
 * {@link AudioDecodeException} when it exists but cannot be read as audio.
 */
public interface AudioDecoder {

  /**
   * Decode an audio file.
   *
   * @param audioFile the file to decode
   * @return the decoded mono waveform
   */
  Waveform decode(Path audioFile);

  /**
   * Short tag describing the decoding settings (e.g. target sample rate).
   *
   * <p>Part of the fingerprint cache key, since different settings produce different features.
   */
  String settingsTag();
}
