package com.scholary.mix.analyzer.matching;

/** Thrown when one analysis step exceeds its configured work budget. */
public class AnalysisTimeoutException extends RuntimeException {

  public AnalysisTimeoutException(String message) {
    super(message);
  }

  public AnalysisTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
