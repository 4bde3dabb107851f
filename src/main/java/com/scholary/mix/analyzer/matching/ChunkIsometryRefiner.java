package com.scholary.mix.analyzer.matching;

import com.scholary.mix.analyzer.dsp.CrossCorrelator;
import com.scholary.mix.analyzer.fingerprint.Fingerprint;
import com.scholary.mix.analyzer.logging.StructuredLogger;
import com.scholary.mix.analyzer.matching.IsometryFinder.IsometryResult;
import com.scholary.mix.analyzer.matching.MatchingProperties.IsometryProperties;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Refines a rough match by matching song chunks individually.
 *
 * <p>Evenly spaced chunks of the song are correlated against the mix around the rough window.
 * The largest group of chunks that agree on the song-to-mix offset is kept, its outer chunks are
 * grown chunk by chunk while the raw chroma stays similar, and the boundaries are then trimmed
 * and extended with successively halved blocks.
 *
 * <p>Confidence is the fraction of sampled chunks in the agreeing group.
 */
@Component
public class ChunkIsometryRefiner implements RefinementStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkIsometryRefiner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final MatchingProperties properties;

  public ChunkIsometryRefiner(MatchingProperties properties) {
    this.properties = properties;
  }

  @Override
  public RefinedMatch refine(RefinementContext context) {
    IsometryProperties config = properties.isometry();
    Fingerprint song = context.song();
    Fingerprint mix = context.mix();
    MatchWindow rough = context.roughWindow();

    int songFrames = song.frameCount();
    int chunkSize = Math.min(songFrames, Math.max(1, song.secondsToFrames(config.chunkSeconds())));

    List<ChunkMatch> matches = matchChunks(song, mix, rough, chunkSize);
    if (matches.isEmpty()) {
      LOGGER.debug("No chunk passed the confidence threshold");
      return RefinedMatch.unlocated(rough, MatchStatus.NO_ISOMETRY);
    }

    IsometryResult isometry =
        IsometryFinder.findLargestIsometry(matches, config.toleranceFrames());
    structuredLogger.logIsometry(
        isometry.members().size(), config.chunks(), isometry.anchorOffset());

    double[][] songFeatures = song.features();
    double[][] mixFeatures = mix.features();

    Region region =
        expand(songFeatures, mixFeatures, isometry.first(), isometry.last(), chunkSize);
    refineOuterChunks(songFeatures, mixFeatures, region, chunkSize);

    double confidence = (double) isometry.members().size() / config.chunks();
    return new RefinedMatch(
        rough,
        song.framesToSeconds(region.songStart),
        song.framesToSeconds(region.songEnd),
        mix.framesToSeconds(region.mixStart),
        mix.framesToSeconds(region.mixEnd),
        confidence,
        MatchStatus.MATCHED);
  }

  @Override
  public RefinementMode mode() {
    return RefinementMode.CHUNK_ISOMETRY;
  }

  @Override
  public String getStrategyName() {
    return "chunk-isometry";
  }

  /**
   * Correlate each sampled chunk against the buffered mix window around the rough start.
   *
   * @return matches in global mix frames, weak chunks dropped
   */
  List<ChunkMatch> matchChunks(
      Fingerprint song, Fingerprint mix, MatchWindow rough, int chunkSize) {
    IsometryProperties config = properties.isometry();
    int songFrames = song.frameCount();
    int mixFrames = mix.frameCount();

    int roughFrame = mix.secondsToFrames(rough.startInMix());
    int buffer = mix.secondsToFrames(config.bufferSeconds());
    int windowStart = Math.max(0, roughFrame - buffer);
    int windowEnd = (int) Math.min(mixFrames, (long) roughFrame + buffer + songFrames);
    RoughMatcher.checkBudget(windowEnd - windowStart, properties.maxCorrelationFrames());

    double[][] mixWindow =
        CrossCorrelator.normalize(CrossCorrelator.slice(mix.features(), windowStart, windowEnd));

    int[] starts = chunkStarts(songFrames, chunkSize, config.chunks());
    List<ChunkMatch> matches = new ArrayList<>();
    for (int i = 0; i < starts.length; i++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new AnalysisTimeoutException("Chunk matching cancelled after " + i + " chunks");
      }
      double[][] chunk =
          CrossCorrelator.normalize(
              CrossCorrelator.slice(song.features(), starts[i], starts[i] + chunkSize));
      double[] scores = CrossCorrelator.correlateValid(mixWindow, chunk);
      if (scores.length == 0) {
        continue;
      }
      int best = CrossCorrelator.argMax(scores);
      ChunkMatch match = new ChunkMatch(i, starts[i], windowStart + best, scores[best]);
      structuredLogger.logChunkMatched(i, match.songFrame(), match.mixFrame(), match.score());
      if (match.score() >= config.chunkConfidenceThreshold()) {
        matches.add(match);
      }
    }
    return matches;
  }

  /** {@code floor(linspace(0, songFrames - chunkSize, count))}. */
  static int[] chunkStarts(int songFrames, int chunkSize, int count) {
    int span = Math.max(0, songFrames - chunkSize);
    int[] starts = new int[count];
    if (count == 1) {
      return starts;
    }
    for (int i = 0; i < count; i++) {
      starts[i] = (int) ((long) i * span / (count - 1));
    }
    return starts;
  }

  /**
   * Grow backwards from the first chunk and forwards from the end of the last one, one chunk at a
   * time, while the raw chroma similarity stays at or above the expansion threshold. The matched
   * chunks themselves are always inside the region.
   */
  Region expand(
      double[][] song, double[][] mix, ChunkMatch first, ChunkMatch last, int chunkSize) {
    double threshold = properties.isometry().expansionThreshold();

    int songStart = first.songFrame();
    int mixStart = first.mixFrame();
    while (CrossCorrelator.cosineSimilarity(
            song, songStart - chunkSize, mix, mixStart - chunkSize, chunkSize)
        >= threshold) {
      songStart -= chunkSize;
      mixStart -= chunkSize;
    }

    int songEnd = last.songFrame() + chunkSize;
    int mixEnd = last.mixFrame() + chunkSize;
    while (CrossCorrelator.cosineSimilarity(song, songEnd, mix, mixEnd, chunkSize) >= threshold) {
      songEnd += chunkSize;
      mixEnd += chunkSize;
    }

    return new Region(
        songStart, songEnd, mixStart, mixEnd, first.songFrame(), last.songFrame() + chunkSize);
  }

  /**
   * Trim dissimilar edge blocks, then extend by similar ones, halving the block size each round
   * down to {@code chunkSize / 2^minChunkFactor}. Trims stop at the matched chunks.
   */
  void refineOuterChunks(double[][] song, double[][] mix, Region region, int chunkSize) {
    IsometryProperties config = properties.isometry();
    double threshold = config.refinementThreshold();
    int minBlock = Math.max(1, chunkSize >> Math.min(config.minChunkFactor(), 30));

    for (int block = chunkSize; block >= minBlock && block > 0; block /= 2) {
      if (region.songStart + block <= region.coreSongStart
          && similarity(song, mix, region.songStart, region.mixStart, block) < threshold) {
        region.songStart += block;
        region.mixStart += block;
      }
      if (region.songEnd - block >= region.coreSongEnd
          && similarity(song, mix, region.songEnd - block, region.mixEnd - block, block)
              < threshold) {
        region.songEnd -= block;
        region.mixEnd -= block;
      }
    }

    for (int block = chunkSize; block >= minBlock && block > 0; block /= 2) {
      if (similarity(song, mix, region.songStart - block, region.mixStart - block, block)
          > threshold) {
        region.songStart -= block;
        region.mixStart -= block;
      }
      if (similarity(song, mix, region.songEnd, region.mixEnd, block) > threshold) {
        region.songEnd += block;
        region.mixEnd += block;
      }
    }

    region.songStart = Math.max(0, region.songStart);
    region.mixStart = Math.max(0, region.mixStart);
    region.songEnd = Math.min(CrossCorrelator.frames(song), region.songEnd);
    region.mixEnd = Math.min(CrossCorrelator.frames(mix), region.mixEnd);
  }

  private static double similarity(
      double[][] song, double[][] mix, int songStart, int mixStart, int length) {
    return CrossCorrelator.cosineSimilarity(song, songStart, mix, mixStart, length);
  }

  /**
   * Matched region in frames, end exclusive. Song and mix ends move together; the song range of
   * the matched chunks, {@code [coreSongStart, coreSongEnd)}, never leaves the region.
   */
  static final class Region {
    int songStart;
    int songEnd;
    int mixStart;
    int mixEnd;
    final int coreSongStart;
    final int coreSongEnd;

    Region(
        int songStart,
        int songEnd,
        int mixStart,
        int mixEnd,
        int coreSongStart,
        int coreSongEnd) {
      this.songStart = songStart;
      this.songEnd = songEnd;
      this.mixStart = mixStart;
      this.mixEnd = mixEnd;
      this.coreSongStart = coreSongStart;
      this.coreSongEnd = coreSongEnd;
    }
  }
}
