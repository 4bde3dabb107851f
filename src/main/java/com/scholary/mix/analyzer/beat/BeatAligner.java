package com.scholary.mix.analyzer.beat;

import com.scholary.mix.analyzer.audio.AudioDecodeException;
import com.scholary.mix.analyzer.audio.AudioDecoder;
import com.scholary.mix.analyzer.audio.MissingInputException;
import com.scholary.mix.analyzer.audio.Waveform;
import com.scholary.mix.analyzer.fingerprint.FingerprintProperties;
import com.scholary.mix.analyzer.logging.StructuredLogger;
import com.scholary.mix.analyzer.matching.MatchStatus;
import com.scholary.mix.analyzer.matching.MatchWindow;
import com.scholary.mix.analyzer.matching.MatchingProperties;
import com.scholary.mix.analyzer.matching.RefinedMatch;
import com.scholary.mix.analyzer.matching.RefinementContext;
import com.scholary.mix.analyzer.matching.RefinementMode;
import com.scholary.mix.analyzer.matching.RefinementStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Snaps a rough match to a downbeat so the cut lands on a bar boundary.
 *
 * <p>Of the two mix downbeats around the rough start, the closer one is chosen (the earlier one
 * on a tie) and the song's first downbeat is placed on it. The result is clamped so the song stays
 * inside the mix. When either recording has no trackable beats the rough window is returned with
 * {@link MatchStatus#BEAT_TRACKING_FAILED}.
 */
@Component
public class BeatAligner implements RefinementStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(BeatAligner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final AudioDecoder decoder;
  private final BeatTracker beatTracker;

  public BeatAligner(
      AudioDecoder decoder,
      MatchingProperties matchingProperties,
      FingerprintProperties fingerprintProperties) {
    this.decoder = decoder;
    this.beatTracker =
        new BeatTracker(
            matchingProperties.beat(),
            fingerprintProperties.fftSize(),
            fingerprintProperties.hopLength());
  }

  @Override
  public RefinedMatch refine(RefinementContext context) {
    Waveform song;
    Waveform mix;
    try {
      song = decoder.decode(context.songPath());
      mix = decoder.decode(context.mixPath());
    } catch (MissingInputException | AudioDecodeException e) {
      LOGGER.warn("Cannot decode audio for beat tracking: {}", e.getMessage());
      return RefinedMatch.fromWindow(context.roughWindow(), MatchStatus.BEAT_TRACKING_FAILED);
    }
    return align(song, mix, context.roughWindow());
  }

  /**
   * Align decoded audio around a rough window.
   *
   * @param song the song waveform
   * @param mix the mix waveform
   * @param rough the rough window in the mix; its duration is the length of the result
   * @return the aligned match, or the rough window flagged as failed
   */
  public RefinedMatch align(Waveform song, Waveform mix, MatchWindow rough) {
    BeatGrid songGrid = beatTracker.track(song);
    BeatGrid mixGrid = beatTracker.track(mix);
    double[] songDownbeats = songGrid.downbeats();
    double[] mixDownbeats = mixGrid.downbeats();
    structuredLogger.logBeatTracking(
        "song", songGrid.tempoBpm(), songGrid.beatTimes().length, songDownbeats.length);
    structuredLogger.logBeatTracking(
        "mix", mixGrid.tempoBpm(), mixGrid.beatTimes().length, mixDownbeats.length);

    if (songDownbeats.length == 0 || mixDownbeats.length == 0) {
      LOGGER.info(
          "Beat tracking found no downbeats (song={}, mix={}), keeping rough window",
          songDownbeats.length,
          mixDownbeats.length);
      return RefinedMatch.fromWindow(rough, MatchStatus.BEAT_TRACKING_FAILED);
    }

    double mixDownbeat = nearestDownbeat(mixDownbeats, rough.startInMix());
    // the rough window spans the song's fingerprint, whole frames included
    double songDuration = rough.duration();
    double latestStart = Math.max(0.0, mix.durationSeconds() - songDuration);
    double refinedStart = Math.max(0.0, Math.min(latestStart, mixDownbeat - songDownbeats[0]));

    return new RefinedMatch(
        rough,
        0.0,
        songDuration,
        refinedStart,
        refinedStart + songDuration,
        rough.confidenceScore(),
        MatchStatus.MATCHED);
  }

  @Override
  public RefinementMode mode() {
    return RefinementMode.BEAT_ALIGNMENT;
  }

  @Override
  public String getStrategyName() {
    return "beat-alignment";
  }

  /** The downbeat just before or just after {@code time}, whichever is closer. */
  static double nearestDownbeat(double[] downbeats, double time) {
    int after = 0;
    while (after < downbeats.length && downbeats[after] < time) {
      after++;
    }
    if (after == 0) {
      return downbeats[0];
    }
    if (after == downbeats.length) {
      return downbeats[downbeats.length - 1];
    }
    double before = downbeats[after - 1];
    return time - before <= downbeats[after] - time ? before : downbeats[after];
  }
}
