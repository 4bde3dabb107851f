package com.scholary.mix.analyzer.config;

import com.scholary.mix.analyzer.audio.AudioDecoder;
import com.scholary.mix.analyzer.audio.FfmpegAudioDecoder;
import com.scholary.mix.analyzer.audio.FfmpegProperties;
import com.scholary.mix.analyzer.audio.RoutingAudioDecoder;
import com.scholary.mix.analyzer.audio.WavAudioDecoder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for audio decoding.
 *
 * <p>Enables the FfmpegProperties to be loaded from application.yml and exposes a single
 * {@link AudioDecoder} that routes WAV files in-process and everything else through ffmpeg.
 */
@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class AudioConfig {

  @Bean
  public AudioDecoder audioDecoder(FfmpegProperties properties) {
    return new RoutingAudioDecoder(
        new WavAudioDecoder(properties.sampleRate()), new FfmpegAudioDecoder(properties));
  }
}
