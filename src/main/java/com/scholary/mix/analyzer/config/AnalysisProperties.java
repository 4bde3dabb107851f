package com.scholary.mix.analyzer.config;

import com.scholary.mix.analyzer.matching.RefinementMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch analysis.
 *
 * <p>Controls the worker pool that runs song/mix comparisons and the wall-clock budget of each
 * comparison.
 */
@ConfigurationProperties(prefix = "analysis")
@Validated
public record AnalysisProperties(
    @Positive int workerThreads,
    @PositiveOrZero int queueSize,
    @Positive long comparisonTimeoutSeconds,
    @NotNull RefinementMode defaultMode) {}
