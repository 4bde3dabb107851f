package com.scholary.mix.analyzer.transition;

/**
 * Song X handing over to song Y inside one mix (an "XTY" record).
 *
 * @param songX outgoing song
 * @param songY incoming song
 * @param mix the mix both were found in
 * @param offsetX mix-to-song offset of X
 * @param offsetY mix-to-song offset of Y
 * @param crossOutX mix time where X ends
 * @param crossInY mix time where Y starts
 */
public record TransitionPair(
    String songX,
    String songY,
    String mix,
    double offsetX,
    double offsetY,
    double crossOutX,
    double crossInY) {

  /** Seconds between X ending and Y starting. */
  public double gap() {
    return crossInY - crossOutX;
  }
}
