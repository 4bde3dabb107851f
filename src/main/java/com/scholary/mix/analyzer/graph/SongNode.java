package com.scholary.mix.analyzer.graph;

import java.util.Map;

/** A song in the transition graph. */
public record SongNode(String songId, Map<String, String> metadata) {

  public SongNode {
    if (songId == null || songId.isBlank()) {
      throw new IllegalArgumentException("Song id is required");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
