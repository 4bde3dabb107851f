package com.scholary.mix.analyzer.audio;

/**
 * Exception thrown when an audio file exists but cannot be decoded.
 *
 * <p>Corrupt files, unsupported containers and a failing ffmpeg process all end up here.
 */
public class AudioDecodeException extends RuntimeException {

  public AudioDecodeException(String message) {
    super(message);
  }

  public AudioDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
