package com.scholary.mix.analyzer.audio;

import java.nio.file.Path;

/** Exception thrown when an audio file (or its cached fingerprint) is absent. */
public class MissingInputException extends RuntimeException {

  private final Path path;

  public MissingInputException(Path path) {
    super("Audio file not found: " + path);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
