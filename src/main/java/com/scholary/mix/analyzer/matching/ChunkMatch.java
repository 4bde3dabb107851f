package com.scholary.mix.analyzer.matching;

/**
 * Best location of one song chunk in the mix.
 *
 * @param chunkIndex position of the chunk among the sampled chunks
 * @param songFrame first song frame of the chunk
 * @param mixFrame mix frame where the chunk correlates best
 * @param score correlation score at that frame
 */
public record ChunkMatch(int chunkIndex, int songFrame, int mixFrame, double score) {

  /** Mix position minus song position; equal for chunks that moved together. */
  public int offset() {
    return mixFrame - songFrame;
  }
}
