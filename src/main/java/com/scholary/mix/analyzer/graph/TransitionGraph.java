package com.scholary.mix.analyzer.graph;

import com.scholary.mix.analyzer.transition.TransitionPair;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed multigraph of songs and the hand-offs observed between them.
 *
 * <p>Songs are stored at dense indices in insertion order so searches can work on ints and bit
 * sets. Several edges may connect the same two songs, one per mix that contained the hand-off.
 * Build the graph once, then only query it; it is not thread-safe for concurrent mutation.
 */
public class TransitionGraph {

  private final Map<String, Integer> indexById = new HashMap<>();
  private final List<SongNode> nodes = new ArrayList<>();
  private final List<List<TransitionEdge>> outEdges = new ArrayList<>();
  private final List<List<Integer>> successors = new ArrayList<>();
  private int edgeCount;

  /** Add a song without metadata. Adding an existing song is a no-op. */
  public int addSong(String songId) {
    return addSong(songId, Map.of());
  }

  /**
   * Add a song.
   *
   * @return the song's index; an existing song keeps its index and metadata
   */
  public int addSong(String songId, Map<String, String> metadata) {
    Integer existing = indexById.get(songId);
    if (existing != null) {
      return existing;
    }
    int index = nodes.size();
    nodes.add(new SongNode(songId, metadata));
    outEdges.add(new ArrayList<>());
    successors.add(new ArrayList<>());
    indexById.put(songId, index);
    return index;
  }

  /** Add the edge for a pair, with {@code sourceEnd = crossOutX + crossfadeSeconds}. */
  public TransitionEdge addTransition(TransitionPair pair, double crossfadeSeconds) {
    TransitionEdge edge = TransitionEdge.fromPair(pair, crossfadeSeconds);
    addTransition(edge);
    return edge;
  }

  /** Add an edge, creating both songs if needed. */
  public void addTransition(TransitionEdge edge) {
    int source = addSong(edge.source());
    int target = addSong(edge.target());
    outEdges.get(source).add(edge);
    List<Integer> next = successors.get(source);
    if (!next.contains(target)) {
      next.add(target);
    }
    edgeCount++;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edgeCount;
  }

  /** Index of a song, or -1 if absent. */
  public int indexOf(String songId) {
    return indexById.getOrDefault(songId, -1);
  }

  public String idOf(int index) {
    return nodes.get(index).songId();
  }

  public Optional<SongNode> getSong(String songId) {
    int index = indexOf(songId);
    return index < 0 ? Optional.empty() : Optional.of(nodes.get(index));
  }

  public List<SongNode> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  /** All outgoing edges of a song, in insertion order; empty for unknown songs. */
  public List<TransitionEdge> getOutEdges(String songId) {
    int index = indexOf(songId);
    return index < 0 ? List.of() : Collections.unmodifiableList(outEdges.get(index));
  }

  public List<TransitionEdge> getOutEdges(int index) {
    return Collections.unmodifiableList(outEdges.get(index));
  }

  /** Edges from {@code source} to {@code target}, in insertion order. */
  public List<TransitionEdge> edgesBetween(String source, String target) {
    List<TransitionEdge> between = new ArrayList<>();
    for (TransitionEdge edge : getOutEdges(source)) {
      if (edge.target().equals(target)) {
        between.add(edge);
      }
    }
    return between;
  }

  /** Distinct target indices of a song's outgoing edges, in first-seen order. */
  public List<Integer> successors(int index) {
    return Collections.unmodifiableList(successors.get(index));
  }

  public boolean hasEdge(String source, String target) {
    int from = indexOf(source);
    int to = indexOf(target);
    return from >= 0 && to >= 0 && successors.get(from).contains(to);
  }
}
