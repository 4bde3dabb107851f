package com.scholary.mix.analyzer.fingerprint;

import com.scholary.mix.analyzer.audio.AudioDecodeException;
import com.scholary.mix.analyzer.audio.AudioDecoder;
import com.scholary.mix.analyzer.audio.MissingInputException;
import com.scholary.mix.analyzer.audio.Waveform;
import com.scholary.mix.analyzer.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Produces chroma fingerprints for audio files, going through the fingerprint cache.
 *
 * <p>Never throws for a bad input file: a missing file or one that cannot be decoded comes back
 * as a {@link FingerprintResult} with the matching status.
 */
@Component
public class FeatureExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureExtractor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int HASH_BUFFER_SIZE = 64 * 1024;

  private final AudioDecoder decoder;
  private final FingerprintCache cache;
  private final FingerprintProperties properties;
  private final ChromaExtractor chromaExtractor;

  public FeatureExtractor(
      AudioDecoder decoder, FingerprintCache cache, FingerprintProperties properties) {
    this.decoder = decoder;
    this.cache = cache;
    this.properties = properties;
    this.chromaExtractor =
        new ChromaExtractor(
            properties.fftSize(), properties.hopLength(), properties.minFrequency());
  }

  /**
   * Load or compute the fingerprint of an audio file.
   *
   * @param audioPath the song or mix file
   * @return the fingerprint with how it was obtained, or a failure status
   */
  public FingerprintResult computeFingerprint(Path audioPath) {
    long startTime = System.currentTimeMillis();
    String source = audioPath.toString();

    if (!Files.isRegularFile(audioPath)) {
      LOGGER.warn("Audio file not found: {}", audioPath);
      return FingerprintResult.failed(
          FingerprintStatus.MISSING_INPUT, "Audio file not found: " + audioPath);
    }

    String cacheKey;
    try {
      cacheKey = cacheKey(audioPath);
    } catch (NoSuchFileException e) {
      return FingerprintResult.failed(
          FingerprintStatus.MISSING_INPUT, "Audio file not found: " + audioPath);
    } catch (IOException e) {
      LOGGER.warn("Cannot read audio file {}: {}", audioPath, e.getMessage());
      return FingerprintResult.failed(
          FingerprintStatus.DECODE_ERROR, "Cannot read " + audioPath + ": " + e.getMessage());
    }

    Optional<Fingerprint> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      Fingerprint fingerprint = cached.get().withSourcePath(source);
      structuredLogger.logFingerprint(
          source, "cached", fingerprint.frameCount(), System.currentTimeMillis() - startTime);
      return FingerprintResult.cached(fingerprint);
    }

    Waveform waveform;
    try {
      waveform = decoder.decode(audioPath);
    } catch (MissingInputException e) {
      LOGGER.warn("Audio file vanished before decoding: {}", audioPath);
      return FingerprintResult.failed(FingerprintStatus.MISSING_INPUT, e.getMessage());
    } catch (AudioDecodeException e) {
      LOGGER.warn("Failed to decode {}: {}", audioPath, e.getMessage());
      return FingerprintResult.failed(FingerprintStatus.DECODE_ERROR, e.getMessage());
    }

    Fingerprint fingerprint = chromaExtractor.extract(waveform, source);

    try {
      cache.put(cacheKey, fingerprint);
    } catch (UncheckedIOException e) {
      LOGGER.warn("Could not cache fingerprint for {}: {}", audioPath, e.getMessage());
    }

    structuredLogger.logFingerprint(
        source, "computed", fingerprint.frameCount(), System.currentTimeMillis() - startTime);
    return FingerprintResult.computed(fingerprint);
  }

  String cacheKey(Path audioPath) throws IOException {
    return FingerprintCache.generateKey(
        sha256(audioPath), properties.hopLength(), properties.fftSize(), decoder.settingsTag());
  }

  static String sha256(Path file) throws IOException {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
    try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
      byte[] buffer = new byte[HASH_BUFFER_SIZE];
      while (in.read(buffer) != -1) {
        // digest is updated as the stream is read
      }
    }
    return HexFormat.of().formatHex(digest.digest());
  }
}
