package com.scholary.mix.analyzer.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.mix.analyzer.fingerprint.Fingerprint;
import com.scholary.mix.analyzer.matching.MatchingProperties.IsometryProperties;
import com.scholary.mix.analyzer.support.ChromaFixtures;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkIsometryRefinerTest {

  private static final int CHUNK = 50;

  private static ChunkIsometryRefiner refiner(double chunkThreshold) {
    MatchingProperties defaults = MatchingProperties.defaults();
    IsometryProperties isometry =
        new IsometryProperties(
            10,
            ChromaFixtures.seconds(CHUNK + 0.5),
            ChromaFixtures.seconds(100.5),
            2,
            chunkThreshold,
            0.6,
            0.8,
            4);
    return new ChunkIsometryRefiner(
        new MatchingProperties(
            defaults.rough(), isometry, defaults.beat(), defaults.maxCorrelationFrames()));
  }

  private static RefinementContext context(Fingerprint song, Fingerprint mix, int roughFrame) {
    double start = mix.framesToSeconds(roughFrame);
    MatchWindow rough =
        new MatchWindow(
            song.sourcePath(), mix.sourcePath(), start, start + song.durationSeconds(), 5000);
    return new RefinementContext(
        Path.of(song.sourcePath()), Path.of(mix.sourcePath()), song, mix, rough);
  }

  @Test
  void refine_shouldRecoverExactRegionOfWholeSong() {
    double[][] songFeatures = ChromaFixtures.randomOneHot(11, 600);
    double[][] mixFeatures = ChromaFixtures.randomOneHot(12, 1200);
    ChromaFixtures.paste(songFeatures, 0, mixFeatures, 300, 600);
    Fingerprint song = ChromaFixtures.fingerprint(songFeatures, "song.wav");
    Fingerprint mix = ChromaFixtures.fingerprint(mixFeatures, "mix.wav");

    RefinedMatch result = refiner(300).refine(context(song, mix, 300));

    assertThat(result.status()).isEqualTo(MatchStatus.MATCHED);
    assertThat(result.songStart()).isZero();
    assertThat(result.songEnd()).isCloseTo(song.framesToSeconds(600), within(1e-9));
    assertThat(result.mixStart()).isCloseTo(mix.framesToSeconds(300), within(1e-9));
    assertThat(result.mixEnd()).isCloseTo(mix.framesToSeconds(900), within(1e-9));
    assertThat(result.confidence()).isEqualTo(1.0);
  }

  @Test
  void refine_shouldTrimToPartOfSongPresentInMix() {
    double[][] songFeatures = ChromaFixtures.randomOneHot(13, 600);
    double[][] mixFeatures = ChromaFixtures.randomOneHot(14, 900);
    // song frames 100..500 play at mix frames 200..600
    ChromaFixtures.paste(songFeatures, 100, mixFeatures, 200, 400);
    Fingerprint song = ChromaFixtures.fingerprint(songFeatures, "song.wav");
    Fingerprint mix = ChromaFixtures.fingerprint(mixFeatures, "mix.wav");

    RefinedMatch result = refiner(300).refine(context(song, mix, 100));

    assertThat(result.status()).isEqualTo(MatchStatus.MATCHED);
    assertThat(result.songStart()).isCloseTo(song.framesToSeconds(100), within(0.5));
    assertThat(result.songEnd()).isCloseTo(song.framesToSeconds(500), within(0.5));
    assertThat(result.mixStart() - result.songStart())
        .isCloseTo(mix.framesToSeconds(100), within(1e-9));
    assertThat(result.mixEnd() - result.songEnd())
        .isCloseTo(mix.framesToSeconds(100), within(1e-9));
    assertThat(result.confidence()).isBetween(0.5, 0.8);
  }

  @Test
  void refineOuterChunks_shouldKeepMatchedChunksEvenWhenDissimilar() {
    double[][] song = ChromaFixtures.randomOneHot(15, 200);
    double[][] mix = ChromaFixtures.randomOneHot(16, 400);
    // only song frames 50..200 really play in the mix; the first chunk is noise there
    ChromaFixtures.paste(song, 50, mix, 150, 150);
    ChunkIsometryRefiner refiner = refiner(300);
    ChunkMatch first = new ChunkMatch(0, 0, 100, 500.0);
    ChunkMatch last = new ChunkMatch(3, 150, 250, 500.0);

    ChunkIsometryRefiner.Region region = refiner.expand(song, mix, first, last, CHUNK);
    refiner.refineOuterChunks(song, mix, region, CHUNK);

    assertThat(region.songStart).isZero();
    assertThat(region.mixStart).isEqualTo(100);
    assertThat(region.songEnd).isEqualTo(200);
    assertThat(region.mixEnd).isEqualTo(300);
  }

  @Test
  void refine_shouldReportNoIsometryWhenNoChunkPassesThreshold() {
    double[][] songFeatures = ChromaFixtures.randomOneHot(15, 300);
    double[][] mixFeatures = ChromaFixtures.randomOneHot(16, 900);
    ChromaFixtures.paste(songFeatures, 0, mixFeatures, 100, 300);
    Fingerprint song = ChromaFixtures.fingerprint(songFeatures, "song.wav");
    Fingerprint mix = ChromaFixtures.fingerprint(mixFeatures, "mix.wav");

    RefinedMatch result = refiner(1e9).refine(context(song, mix, 100));

    assertThat(result.status()).isEqualTo(MatchStatus.NO_ISOMETRY);
    assertThat(result.isLocated()).isFalse();
  }

  @Test
  void matchChunks_shouldReportGlobalMixFrames() {
    double[][] songFeatures = ChromaFixtures.randomOneHot(17, 600);
    double[][] mixFeatures = ChromaFixtures.randomOneHot(18, 1500);
    ChromaFixtures.paste(songFeatures, 0, mixFeatures, 700, 600);
    Fingerprint song = ChromaFixtures.fingerprint(songFeatures, "song.wav");
    Fingerprint mix = ChromaFixtures.fingerprint(mixFeatures, "mix.wav");

    List<ChunkMatch> matches =
        refiner(300).matchChunks(song, mix, context(song, mix, 720).roughWindow(), CHUNK);

    assertThat(matches).hasSize(10);
    assertThat(matches).allSatisfy(match -> assertThat(match.offset()).isEqualTo(700));
  }

  @Test
  void chunkStarts_shouldSpreadChunksAcrossSong() {
    assertThat(ChunkIsometryRefiner.chunkStarts(600, 50, 10))
        .containsExactly(0, 61, 122, 183, 244, 305, 366, 427, 488, 550);
    assertThat(ChunkIsometryRefiner.chunkStarts(600, 50, 1)).containsExactly(0);
    assertThat(ChunkIsometryRefiner.chunkStarts(40, 40, 3)).containsExactly(0, 0, 0);
  }

  @Test
  void strategy_shouldIdentifyItself() {
    ChunkIsometryRefiner refiner = refiner(300);

    assertThat(refiner.mode()).isEqualTo(RefinementMode.CHUNK_ISOMETRY);
    assertThat(refiner.getStrategyName()).isEqualTo("chunk-isometry");
  }
}
