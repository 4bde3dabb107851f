package com.scholary.mix.analyzer.fingerprint;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for chroma fingerprinting and the fingerprint cache.
 *
 * <p>Changing {@code hopLength} or {@code fftSize} changes the cache key, so old entries are simply
 * never hit again rather than returned stale.
 */
@ConfigurationProperties(prefix = "fingerprint")
@Validated
public record FingerprintProperties(
    @Positive int hopLength,
    @Positive int fftSize,
    @Positive double minFrequency,
    @NotBlank String cacheDir,
    @Positive int memoryCacheSize) {}
