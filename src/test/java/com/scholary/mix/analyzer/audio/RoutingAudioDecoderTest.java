package com.scholary.mix.analyzer.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RoutingAudioDecoderTest {

  @Mock private AudioDecoder wavDecoder;
  @Mock private AudioDecoder fallbackDecoder;

  @Test
  void decode_shouldSendWavFilesToWavDecoder() {
    RoutingAudioDecoder decoder = new RoutingAudioDecoder(wavDecoder, fallbackDecoder);
    Path wav = Path.of("/music/Track.WAV");
    Waveform waveform = new Waveform(new float[10], 22050);
    when(wavDecoder.decode(wav)).thenReturn(waveform);

    assertThat(decoder.decode(wav)).isSameAs(waveform);
    verify(fallbackDecoder, never()).decode(wav);
  }

  @Test
  void select_shouldSendEverythingElseToFallback() {
    RoutingAudioDecoder decoder = new RoutingAudioDecoder(wavDecoder, fallbackDecoder);

    assertThat(decoder.select(Path.of("set.mp3"))).isSameAs(fallbackDecoder);
    assertThat(decoder.select(Path.of("song.m4a"))).isSameAs(fallbackDecoder);
    assertThat(decoder.select(Path.of("take.wave"))).isSameAs(wavDecoder);
  }

  @Test
  void settingsTag_shouldCombineBothDecoders() {
    when(wavDecoder.settingsTag()).thenReturn("wav-22050");
    when(fallbackDecoder.settingsTag()).thenReturn("ffmpeg-22050");

    RoutingAudioDecoder decoder = new RoutingAudioDecoder(wavDecoder, fallbackDecoder);

    assertThat(decoder.settingsTag()).isEqualTo("wav-22050+ffmpeg-22050");
  }
}
