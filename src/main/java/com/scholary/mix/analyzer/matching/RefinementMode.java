package com.scholary.mix.analyzer.matching;

/** Which refinement runs after the rough match. */
public enum RefinementMode {
  /** Keep the rough window. */
  ROUGH,

  /** Chunk matching, isometry detection and boundary refinement. */
  CHUNK_ISOMETRY,

  /** Snap the rough start to the nearest downbeat. */
  BEAT_ALIGNMENT
}
