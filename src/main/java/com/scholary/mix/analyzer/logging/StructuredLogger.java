package com.scholary.mix.analyzer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the event's fields into the MDC for the duration of one log call, so they
 * show up as queryable fields next to the message.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log fingerprint served event. */
  public void logFingerprint(String path, String status, int frames, long elapsedMs) {
    try {
      MDC.put("event_type", "fingerprint");
      MDC.put("path", path);
      MDC.put("status", status);
      MDC.put("frames", String.valueOf(frames));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Fingerprint {}: path={}, frames={}, elapsed={}ms", status, path, frames, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log rough match event. */
  public void logRoughMatch(double startInMix, double endInMix, double confidence, boolean found) {
    try {
      MDC.put("event_type", "rough_match");
      MDC.put("start", String.valueOf(startInMix));
      MDC.put("end", String.valueOf(endInMix));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("found", String.valueOf(found));

      logger.debug(
          "Rough match: found={}, range=[{}-{}], confidence={}",
          found,
          startInMix,
          endInMix,
          confidence);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk correlation event. */
  public void logChunkMatched(int chunkIndex, int songFrame, int mixFrame, double score) {
    try {
      MDC.put("event_type", "chunk_matched");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("songFrame", String.valueOf(songFrame));
      MDC.put("mixFrame", String.valueOf(mixFrame));
      MDC.put("confidence", String.valueOf(score));

      logger.trace(
          "Chunk matched: index={}, songFrame={}, mixFrame={}, score={}",
          chunkIndex,
          songFrame,
          mixFrame,
          score);
    } finally {
      clearEventFields();
    }
  }

  /** Log isometry detection event. */
  public void logIsometry(int subsetSize, int chunkCount, int offsetFrames) {
    try {
      MDC.put("event_type", "isometry");
      MDC.put("subsetSize", String.valueOf(subsetSize));
      MDC.put("chunkCount", String.valueOf(chunkCount));
      MDC.put("offsetFrames", String.valueOf(offsetFrames));

      logger.debug(
          "Isometry: {}/{} chunks agree, offset={} frames", subsetSize, chunkCount, offsetFrames);
    } finally {
      clearEventFields();
    }
  }

  /** Log beat tracking event. */
  public void logBeatTracking(String track, double tempoBpm, int beats, int downbeats) {
    try {
      MDC.put("event_type", "beat_tracking");
      MDC.put("track", track);
      MDC.put("tempoBpm", String.valueOf(tempoBpm));
      MDC.put("beats", String.valueOf(beats));

      logger.debug(
          "Beat tracking: track={}, tempo={}bpm, beats={}, downbeats={}",
          track,
          tempoBpm,
          beats,
          downbeats);
    } finally {
      clearEventFields();
    }
  }

  /** Log refinement finished event. */
  public void logRefinementFinished(
      String strategy, String status, double mixStart, double mixEnd, long elapsedMs) {
    try {
      MDC.put("event_type", "refinement_finished");
      MDC.put("strategy", strategy);
      MDC.put("status", status);
      MDC.put("start", String.valueOf(mixStart));
      MDC.put("end", String.valueOf(mixEnd));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Refinement finished: strategy={}, status={}, range=[{}-{}], elapsed={}ms",
          strategy,
          status,
          mixStart,
          mixEnd,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log comparison failure event. */
  public void logAnalysisFailed(String songPath, String mixPath, String errorType, String message) {
    try {
      MDC.put("event_type", "analysis_failed");
      MDC.put("errorType", errorType);

      logger.error(
          "Analysis failed: song={}, mix={}, error={}, message={}",
          songPath,
          mixPath,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress event. */
  public void logBatchProgress(int completed, int total, int matched) {
    try {
      MDC.put("event_type", "batch_progress");
      MDC.put("completed", String.valueOf(completed));
      MDC.put("total", String.valueOf(total));
      MDC.put("matched", String.valueOf(matched));

      logger.info("Batch progress: comparisons={}/{}, matched={}", completed, total, matched);
    } finally {
      clearEventFields();
    }
  }

  /** Log path selection event. */
  public void logPathSelected(String selector, int nodes, int edges, int pathLength) {
    try {
      MDC.put("event_type", "path_selected");
      MDC.put("selector", selector);
      MDC.put("nodes", String.valueOf(nodes));
      MDC.put("edges", String.valueOf(edges));
      MDC.put("pathLength", String.valueOf(pathLength));

      logger.info(
          "Path selected: selector={}, graph={} nodes/{} edges, length={}",
          selector,
          nodes,
          edges,
          pathLength);
    } finally {
      clearEventFields();
    }
  }

  /** Set comparison context in MDC. */
  public static void setComparisonContext(String correlationId, String songPath, String mixPath) {
    MDC.put("correlationId", correlationId);
    MDC.put("song", songPath);
    MDC.put("mix", mixPath);
  }

  /** Clear comparison context from MDC. */
  public static void clearComparisonContext() {
    MDC.remove("correlationId");
    MDC.remove("song");
    MDC.remove("mix");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("path");
    MDC.remove("status");
    MDC.remove("frames");
    MDC.remove("elapsedMs");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("confidence");
    MDC.remove("found");
    MDC.remove("chunk_index");
    MDC.remove("songFrame");
    MDC.remove("mixFrame");
    MDC.remove("subsetSize");
    MDC.remove("chunkCount");
    MDC.remove("offsetFrames");
    MDC.remove("track");
    MDC.remove("tempoBpm");
    MDC.remove("beats");
    MDC.remove("strategy");
    MDC.remove("errorType");
    MDC.remove("completed");
    MDC.remove("total");
    MDC.remove("matched");
    MDC.remove("selector");
    MDC.remove("nodes");
    MDC.remove("edges");
    MDC.remove("pathLength");
  }
}
