package com.scholary.mix.analyzer.matching;

/** Result status of comparing one song against one mix. */
public enum MatchStatus {
  /** Song located; the refined window is trustworthy. */
  MATCHED,

  /** Song or mix fingerprint could not be produced. */
  NO_FINGERPRINT,

  /** Rough cross-correlation stayed below the confidence threshold. */
  NO_MATCH,

  /** Rough match found, but no chunk survived chunk matching. */
  NO_ISOMETRY,

  /** Beats could not be tracked; the rough window is returned unchanged. */
  BEAT_TRACKING_FAILED,

  /** The comparison exceeded its time budget. */
  TIMED_OUT,

  /** The comparison failed with an unexpected error. */
  FAILED;

  /** Whether a match with this status carries a usable location. */
  public boolean isLocated() {
    return this == MATCHED || this == BEAT_TRACKING_FAILED;
  }
}
