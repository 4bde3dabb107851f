package com.scholary.mix.analyzer.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.mix.analyzer.transition.TransitionPair;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransitionGraphTest {

  @Test
  void addSong_shouldKeepFirstIndexAndMetadata() {
    TransitionGraph graph = new TransitionGraph();

    int first = graph.addSong("a", Map.of("title", "First"));
    int again = graph.addSong("a", Map.of("title", "Other"));

    assertThat(again).isEqualTo(first);
    assertThat(graph.nodeCount()).isEqualTo(1);
    assertThat(graph.nodes()).extracting(SongNode::songId).containsExactly("a");
    assertThat(graph.getSong("a").orElseThrow().metadata()).containsEntry("title", "First");
  }

  @Test
  void addTransition_shouldAddCrossfadeToSourceEnd() {
    TransitionGraph graph = new TransitionGraph();
    TransitionPair pair = new TransitionPair("x", "y", "mix", 10.0, 190.0, 200.0, 220.0);

    TransitionEdge edge = graph.addTransition(pair, 5.0);

    assertThat(edge.sourceEnd()).isEqualTo(205.0);
    assertThat(edge.targetStart()).isEqualTo(220.0);
    assertThat(edge.mixId()).isEqualTo("mix");
    assertThat(edge.pair()).isSameAs(pair);
    assertThat(graph.nodeCount()).isEqualTo(2);
  }

  @Test
  void addTransition_shouldKeepParallelEdgesButDistinctSuccessors() {
    TransitionGraph graph = new TransitionGraph();
    graph.addTransition(new TransitionEdge("a", "b", 10, 5, "m1", null));
    graph.addTransition(new TransitionEdge("a", "b", 20, 15, "m2", null));
    graph.addTransition(new TransitionEdge("a", "c", 30, 25, "m1", null));

    assertThat(graph.edgeCount()).isEqualTo(3);
    assertThat(graph.edgesBetween("a", "b"))
        .extracting(TransitionEdge::mixId)
        .containsExactly("m1", "m2");
    assertThat(graph.successors(graph.indexOf("a")))
        .containsExactly(graph.indexOf("b"), graph.indexOf("c"));
    assertThat(graph.hasEdge("a", "c")).isTrue();
    assertThat(graph.hasEdge("c", "a")).isFalse();
  }

  @Test
  void queries_shouldHandleUnknownSongs() {
    TransitionGraph graph = new TransitionGraph();

    assertThat(graph.indexOf("missing")).isEqualTo(-1);
    assertThat(graph.getSong("missing")).isEmpty();
    assertThat(graph.getOutEdges("missing")).isEmpty();
    assertThat(graph.edgesBetween("missing", "other")).isEmpty();
    assertThat(graph.hasEdge("missing", "other")).isFalse();
  }
}
