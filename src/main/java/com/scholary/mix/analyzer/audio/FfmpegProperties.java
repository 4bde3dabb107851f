package com.scholary.mix.analyzer.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg decoding.
 *
 * <p>Everything that is not a WAV file is decoded by piping it through ffmpeg. {@code sampleRate}
 * is the analysis rate for every decoder: WAV files are resampled to it as well, so fingerprints
 * of any two files share one frame grid.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @Positive int sampleRate,
    @Positive int timeoutSeconds) {}
