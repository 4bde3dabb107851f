package com.scholary.mix.analyzer.fingerprint;

/** How a fingerprint request was served, or why it could not be. */
public enum FingerprintStatus {
  /** Decoded and computed on this call, then written to the cache. */
  COMPUTED,

  /** Served from the memory or disk cache. */
  CACHED,

  /** The audio file does not exist. */
  MISSING_INPUT,

  /** The audio file exists but could not be decoded. */
  DECODE_ERROR
}
