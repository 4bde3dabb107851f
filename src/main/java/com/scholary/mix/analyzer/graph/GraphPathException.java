package com.scholary.mix.analyzer.graph;

/** Thrown when a requested path cannot be realised with the edges in the graph. */
public class GraphPathException extends RuntimeException {

  public GraphPathException(String message) {
    super(message);
  }

  public GraphPathException(String message, Throwable cause) {
    super(message, cause);
  }
}
