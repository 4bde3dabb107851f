package com.scholary.mix.analyzer.config;

import com.scholary.mix.analyzer.fingerprint.DiskFingerprintCache;
import com.scholary.mix.analyzer.fingerprint.FingerprintCache;
import com.scholary.mix.analyzer.fingerprint.FingerprintProperties;
import com.scholary.mix.analyzer.matching.MatchingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for fingerprinting and matching.
 *
 * <p>Enables the FingerprintProperties and MatchingProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({FingerprintProperties.class, MatchingProperties.class})
public class MatchingConfig {

  @Bean
  public FingerprintCache fingerprintCache(FingerprintProperties properties) {
    return new DiskFingerprintCache(properties);
  }
}
