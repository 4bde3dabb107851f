package com.scholary.mix.analyzer.service;

import com.scholary.mix.analyzer.config.AnalysisProperties;
import com.scholary.mix.analyzer.fingerprint.FeatureExtractor;
import com.scholary.mix.analyzer.fingerprint.FingerprintResult;
import com.scholary.mix.analyzer.logging.StructuredLogger;
import com.scholary.mix.analyzer.matching.AnalysisTimeoutException;
import com.scholary.mix.analyzer.matching.MatchStatus;
import com.scholary.mix.analyzer.matching.MatchWindow;
import com.scholary.mix.analyzer.matching.RefinedMatch;
import com.scholary.mix.analyzer.matching.RefinementContext;
import com.scholary.mix.analyzer.matching.RefinementMode;
import com.scholary.mix.analyzer.matching.RefinementStrategy;
import com.scholary.mix.analyzer.matching.RoughMatcher;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Locates songs in mixes using pluggable refinement strategies.
 *
 * <p>A comparison fingerprints both files, finds the rough window and hands it to the strategy
 * registered for the requested {@link RefinementMode}. Batches run on the analysis worker pool;
 * one failing or slow comparison never aborts the rest.
 */
@Service
public class MixAnalysisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MixAnalysisService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final long START_POLL_MILLIS = 50;

  private final FeatureExtractor featureExtractor;
  private final RoughMatcher roughMatcher;
  private final Map<RefinementMode, RefinementStrategy> strategies;
  private final Executor executor;
  private final AnalysisProperties properties;

  public MixAnalysisService(
      FeatureExtractor featureExtractor,
      RoughMatcher roughMatcher,
      List<RefinementStrategy> strategies,
      @Qualifier("analysisExecutor") Executor executor,
      AnalysisProperties properties) {
    this.featureExtractor = featureExtractor;
    this.roughMatcher = roughMatcher;
    this.executor = executor;
    this.properties = properties;

    this.strategies = new EnumMap<>(RefinementMode.class);
    for (RefinementStrategy strategy : strategies) {
      this.strategies.put(strategy.mode(), strategy);
    }
  }

  /** Compare with the configured default mode. */
  public MatchOutcome analyze(Path songPath, Path mixPath) {
    return analyze(songPath, mixPath, properties.defaultMode());
  }

  /**
   * Locate a song in a mix.
   *
   * @param songPath the song file
   * @param mixPath the mix file
   * @param mode which refinement to run after the rough match
   * @return the outcome; missing files and non-matches are reported through its status
   * @throws AnalysisTimeoutException if a step exceeds its work budget
   */
  public MatchOutcome analyze(Path songPath, Path mixPath, RefinementMode mode) {
    RefinementStrategy strategy = strategies.get(mode);
    if (strategy == null) {
      throw new IllegalArgumentException("No refinement strategy registered for " + mode);
    }

    Comparison comparison = new Comparison(songPath, mixPath);
    StructuredLogger.setComparisonContext(
        UUID.randomUUID().toString(), songPath.toString(), mixPath.toString());
    long startTime = System.currentTimeMillis();

    try {
      LOGGER.info("Starting analysis: song={}, mix={}, mode={}", songPath, mixPath, mode);

      FingerprintResult song = featureExtractor.computeFingerprint(songPath);
      if (!song.isPresent()) {
        return MatchOutcome.failed(comparison, MatchStatus.NO_FINGERPRINT, song.message());
      }
      checkNotCancelled("fingerprinting the mix");
      FingerprintResult mix = featureExtractor.computeFingerprint(mixPath);
      if (!mix.isPresent()) {
        return MatchOutcome.failed(comparison, MatchStatus.NO_FINGERPRINT, mix.message());
      }

      checkNotCancelled("rough matching");
      Optional<MatchWindow> rough = roughMatcher.roughMatch(song.fingerprint(), mix.fingerprint());
      if (rough.isEmpty()) {
        LOGGER.info("No rough match for {} in {}", songPath, mixPath);
        return MatchOutcome.failed(
            comparison, MatchStatus.NO_MATCH, "Best correlation below confidence threshold");
      }

      checkNotCancelled("refinement");
      RefinedMatch refined =
          strategy.refine(
              new RefinementContext(
                  songPath, mixPath, song.fingerprint(), mix.fingerprint(), rough.get()));
      structuredLogger.logRefinementFinished(
          strategy.getStrategyName(),
          refined.status().name(),
          refined.mixStart(),
          refined.mixEnd(),
          System.currentTimeMillis() - startTime);

      return MatchOutcome.refined(comparison, refined, strategy.getStrategyName());

    } finally {
      StructuredLogger.clearComparisonContext();
    }
  }

  private static void checkNotCancelled(String nextStep) {
    if (Thread.currentThread().isInterrupted()) {
      throw new AnalysisTimeoutException("Comparison cancelled before " + nextStep);
    }
  }

  /**
   * Run many comparisons on the worker pool.
   *
   * <p>Each comparison gets {@code comparisonTimeoutSeconds} from the moment a worker picks it
   * up. A comparison that runs out of time or budget becomes {@link MatchStatus#TIMED_OUT} and its
   * worker is interrupted; one that throws becomes {@link MatchStatus#FAILED}. Comparisons always
   * run on the pool: when it rejects one, the oldest outstanding comparison is awaited before
   * submitting again.
   *
   * @return one outcome per comparison, in input order
   */
  public List<MatchOutcome> analyzeAll(List<Comparison> comparisons, RefinementMode mode) {
    List<PendingComparison> pending = new ArrayList<>();
    MatchOutcome[] outcomes = new MatchOutcome[comparisons.size()];
    int awaited = 0;

    for (Comparison comparison : comparisons) {
      PendingComparison next = newPending(comparison, mode);
      pending.add(next);
      long budgetNanos = TimeUnit.SECONDS.toNanos(properties.comparisonTimeoutSeconds());
      long giveUpAt = System.nanoTime() + budgetNanos;

      while (true) {
        try {
          executor.execute(next.task());
          break;
        } catch (RejectedExecutionException e) {
          if (awaited < pending.size() - 1) {
            outcomes[awaited] = await(pending.get(awaited));
            awaited++;
            giveUpAt = System.nanoTime() + budgetNanos;
          } else if (System.nanoTime() > giveUpAt || !pauseBeforeResubmit()) {
            next.task().cancel(false);
            outcomes[pending.size() - 1] =
                failure(
                    comparison,
                    MatchStatus.FAILED,
                    "Worker pool rejected comparison: " + e.getMessage(),
                    e.getClass().getSimpleName());
            break;
          }
        }
      }
    }

    for (; awaited < pending.size(); awaited++) {
      if (outcomes[awaited] == null) {
        outcomes[awaited] = await(pending.get(awaited));
      }
    }

    int located = 0;
    for (int i = 0; i < outcomes.length; i++) {
      if (outcomes[i].isLocated()) {
        located++;
      }
      structuredLogger.logBatchProgress(i + 1, outcomes.length, located);
    }
    return List.of(outcomes);
  }

  private PendingComparison newPending(Comparison comparison, RefinementMode mode) {
    AtomicLong startedAt = new AtomicLong();
    AtomicLong finishedAt = new AtomicLong();
    FutureTask<MatchOutcome> task =
        new FutureTask<>(
            () -> {
              startedAt.set(System.nanoTime());
              try {
                return analyze(comparison.songPath(), comparison.mixPath(), mode);
              } finally {
                finishedAt.set(System.nanoTime());
              }
            });
    return new PendingComparison(comparison, startedAt, finishedAt, task);
  }

  /** Every worker is busy with an abandoned comparison; give it a moment to notice. */
  private static boolean pauseBeforeResubmit() {
    try {
      Thread.sleep(START_POLL_MILLIS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private MatchOutcome await(PendingComparison pending) {
    Comparison comparison = pending.comparison();
    long budgetNanos = TimeUnit.SECONDS.toNanos(properties.comparisonTimeoutSeconds());
    try {
      // queued comparisons have not started their clock yet
      while (pending.startedAt().get() == 0 && !pending.task().isDone()) {
        Thread.sleep(START_POLL_MILLIS);
      }
      long startedAt = pending.startedAt().get();
      long remaining = startedAt == 0 ? 0 : budgetNanos - (System.nanoTime() - startedAt);
      MatchOutcome outcome = pending.task().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);

      long finishedAt = pending.finishedAt().get();
      if (startedAt != 0 && finishedAt - startedAt > budgetNanos) {
        return timedOut(comparison);
      }
      return outcome;

    } catch (TimeoutException e) {
      pending.task().cancel(true);
      return timedOut(comparison);
    } catch (CancellationException e) {
      return timedOut(comparison);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      MatchStatus status =
          cause instanceof AnalysisTimeoutException ? MatchStatus.TIMED_OUT : MatchStatus.FAILED;
      return failure(comparison, status, cause.getMessage(), cause.getClass().getSimpleName());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.task().cancel(true);
      return failure(comparison, MatchStatus.FAILED, "Interrupted", "InterruptedException");
    }
  }

  private MatchOutcome timedOut(Comparison comparison) {
    return failure(
        comparison,
        MatchStatus.TIMED_OUT,
        "Timed out after " + properties.comparisonTimeoutSeconds() + "s",
        "TimeoutException");
  }

  private MatchOutcome failure(
      Comparison comparison, MatchStatus status, String message, String errorType) {
    structuredLogger.logAnalysisFailed(
        comparison.songPath().toString(), comparison.mixPath().toString(), errorType, message);
    return MatchOutcome.failed(comparison, status, message);
  }

  private record PendingComparison(
      Comparison comparison,
      AtomicLong startedAt,
      AtomicLong finishedAt,
      FutureTask<MatchOutcome> task) {}
}
