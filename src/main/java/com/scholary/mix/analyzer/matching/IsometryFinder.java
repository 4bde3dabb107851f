package com.scholary.mix.analyzer.matching;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the largest group of chunk matches that moved together from song to mix.
 *
 * <p>Two chunks {@code a, b} agree when {@code |(mix_b - mix_a) - (song_b - song_a)| <= tol},
 * which is the same as their offsets {@code mix - song} differing by at most {@code tol}. A set in
 * which every pair agrees has all its offsets inside {@code [d, d + tol]} where {@code d} is its
 * smallest offset, so trying each chunk's offset as {@code d} finds the largest such set exactly.
 */
public final class IsometryFinder {

  private IsometryFinder() {}

  /**
   * Result of the isometry search.
   *
   * @param members the agreeing chunks, in chunk order
   * @param anchorOffset smallest offset in the group, in frames
   */
  public record IsometryResult(List<ChunkMatch> members, int anchorOffset) {

    public boolean hasMatch() {
      return !members.isEmpty();
    }

    public ChunkMatch first() {
      return members.get(0);
    }

    public ChunkMatch last() {
      return members.get(members.size() - 1);
    }
  }

  /**
   * Find the largest pairwise-consistent subset.
   *
   * <p>Anchors are tried in chunk order and a later anchor only wins with a strictly larger group,
   * so ties go to the group anchored at the earliest chunk.
   *
   * @param matches chunk matches in any order
   * @param toleranceFrames allowed offset disagreement between any two members
   * @return the largest group, empty if there are no matches
   */
  public static IsometryResult findLargestIsometry(List<ChunkMatch> matches, int toleranceFrames) {
    if (matches.isEmpty()) {
      return new IsometryResult(List.of(), 0);
    }

    List<ChunkMatch> ordered = new ArrayList<>(matches);
    ordered.sort(Comparator.comparingInt(ChunkMatch::chunkIndex));

    List<ChunkMatch> best = List.of();
    int bestAnchor = 0;

    for (ChunkMatch anchor : ordered) {
      int low = anchor.offset();
      long high = (long) low + toleranceFrames;

      List<ChunkMatch> group = new ArrayList<>();
      for (ChunkMatch candidate : ordered) {
        int offset = candidate.offset();
        if (offset >= low && offset <= high) {
          group.add(candidate);
        }
      }

      if (group.size() > best.size()) {
        best = group;
        bestAnchor = low;
      }
    }

    return new IsometryResult(List.copyOf(best), bestAnchor);
  }
}
