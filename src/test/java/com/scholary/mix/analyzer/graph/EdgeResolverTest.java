package com.scholary.mix.analyzer.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class EdgeResolverTest {

  private static TransitionEdge edge(
      String source, String target, double sourceEnd, double targetStart, String mix) {
    return new TransitionEdge(source, target, sourceEnd, targetStart, mix, null);
  }

  private static TransitionGraph graph(double firstTargetStart) {
    TransitionGraph graph = new TransitionGraph();
    graph.addTransition(edge("A", "B", 100.0, firstTargetStart, "m1"));
    graph.addTransition(edge("B", "C", 90.0, 200.0, "m2"));
    graph.addTransition(edge("B", "C", 150.0, 50.0, "m3"));
    return graph;
  }

  @Test
  void resolveEdges_shouldPickLatestSourceEnd() {
    List<TransitionEdge> edges =
        new EdgeResolver().resolveEdges(graph(80.0), List.of("A", "B", "C"));

    assertThat(edges).extracting(TransitionEdge::mixId).containsExactly("m1", "m3");
  }

  @Test
  void resolveEdges_shouldExcludeEdgesEndingBeforePreviousStart() {
    EdgeResolver firstAdmissible =
        new EdgeResolver(admissible -> admissible.stream().findFirst());

    List<TransitionEdge> early =
        firstAdmissible.resolveEdges(graph(80.0), List.of("A", "B", "C"));
    List<TransitionEdge> late =
        firstAdmissible.resolveEdges(graph(120.0), List.of("A", "B", "C"));

    assertThat(early.get(1).mixId()).isEqualTo("m2");
    assertThat(late.get(1).mixId()).isEqualTo("m3");
  }

  @Test
  void resolveEdges_shouldAdmitEdgeEndingExactlyAtPreviousStart() {
    List<TransitionEdge> edges =
        new EdgeResolver().resolveEdges(graph(150.0), List.of("A", "B", "C"));

    assertThat(edges.get(1).sourceEnd()).isEqualTo(150.0);
  }

  @Test
  void resolveEdges_shouldFailWhenEveryEdgeIsExcluded() {
    assertThatThrownBy(
            () -> new EdgeResolver().resolveEdges(graph(151.0), List.of("A", "B", "C")))
        .isInstanceOf(GraphPathException.class)
        .hasMessageContaining("All 2 transitions from B to C");
  }

  @Test
  void resolveEdges_shouldFailForMissingHop() {
    assertThatThrownBy(() -> new EdgeResolver().resolveEdges(graph(80.0), List.of("A", "C")))
        .isInstanceOf(GraphPathException.class)
        .hasMessage("No transition from A to C");
  }

  @Test
  void resolveEdges_shouldReturnNothingForShortPaths() {
    EdgeResolver resolver = new EdgeResolver();

    assertThat(resolver.resolveEdges(graph(80.0), List.of("A"))).isEmpty();
    assertThat(resolver.resolveEdges(graph(80.0), List.of())).isEmpty();
  }

  @Test
  void maxSourceEnd_shouldKeepFirstOnTie() {
    TransitionEdge first = edge("A", "B", 10.0, 0.0, "first");
    TransitionEdge second = edge("A", "B", 10.0, 0.0, "second");

    assertThat(EdgeSelectionPolicy.maxSourceEnd().select(List.of(first, second)))
        .contains(first);
  }
}
