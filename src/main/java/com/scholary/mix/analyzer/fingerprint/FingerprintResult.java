package com.scholary.mix.analyzer.fingerprint;

import java.util.Optional;

/**
 * Outcome of {@link FeatureExtractor#computeFingerprint}.
 *
 * @param fingerprint the fingerprint, or null when the status is a failure
 * @param status how the request was served
 * @param message failure detail, null on success
 */
public record FingerprintResult(Fingerprint fingerprint, FingerprintStatus status, String message) {

  public static FingerprintResult computed(Fingerprint fingerprint) {
    return new FingerprintResult(fingerprint, FingerprintStatus.COMPUTED, null);
  }

  public static FingerprintResult cached(Fingerprint fingerprint) {
    return new FingerprintResult(fingerprint, FingerprintStatus.CACHED, null);
  }

  public static FingerprintResult failed(FingerprintStatus status, String message) {
    return new FingerprintResult(null, status, message);
  }

  public boolean isPresent() {
    return fingerprint != null;
  }

  public Optional<Fingerprint> asOptional() {
    return Optional.ofNullable(fingerprint);
  }
}
