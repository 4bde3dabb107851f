package com.scholary.mix.analyzer.fingerprint;

import java.util.Optional;

/**
 * Persistent store for computed fingerprints so a song or mix is decoded and analysed only once
 * across runs.
 *
 * <p>Cache keys are based on: content hash + hop length + FFT size + decoder settings. The file
 * name plays no part, so two files sharing a basename never collide and a renamed file still hits.
 */
public interface FingerprintCache {

  /**
   * Store a fingerprint. Storing the same key twice is harmless; the last write wins.
   *
   * @param cacheKey key from {@link #generateKey}
   * @param fingerprint the fingerprint to cache
   */
  void put(String cacheKey, Fingerprint fingerprint);

  /**
   * Retrieve a cached fingerprint.
   *
   * @param cacheKey key from {@link #generateKey}
   * @return the cached fingerprint, or empty if not found
   */
  Optional<Fingerprint> get(String cacheKey);

  /**
   * Remove a fingerprint from the cache.
   *
   * @param cacheKey key from {@link #generateKey}
   */
  void evict(String cacheKey);

  /**
   * Generate a cache key for a fingerprint.
   *
   * @param contentHash hex SHA-256 of the audio file content
   * @param hopLength STFT hop length
   * @param fftSize STFT size
   * @param decoderTag decoder settings tag
   * @return a unique, filesystem-safe cache key
   */
  static String generateKey(String contentHash, int hopLength, int fftSize, String decoderTag) {
    String tag = decoderTag.replaceAll("[^A-Za-z0-9_-]", "_");
    return String.format("%s-h%d-n%d-%s", contentHash, hopLength, fftSize, tag);
  }
}
