package com.scholary.mix.analyzer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mix.analyzer.graph.TransitionEdge;
import com.scholary.mix.analyzer.transition.TransitionPair;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TransitionPlanWriterTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private TransitionPlanWriter writer;

  @BeforeEach
  void setUp() {
    writer = new TransitionPlanWriter(objectMapper);
  }

  private static TransitionPlan plan() {
    TransitionPair pair = new TransitionPair("a.wav", "b.wav", "set.wav", 12.5, 98.0, 200.0, 210.0);
    return new TransitionPlan(
        List.of("a.wav", "b.wav", "c.wav"),
        List.of(
            TransitionEdge.fromPair(pair, 5.0),
            new TransitionEdge("b.wav", "c.wav", 330.0, 325.0, "other.wav", null)));
  }

  @Test
  void writeJson_shouldListSongsAndTransitions() throws IOException {
    JsonNode root = objectMapper.readTree(writer.writeJson(plan()));

    assertThat(root.get("songs").size()).isEqualTo(3);
    assertThat(root.get("songs").get(0).asText()).isEqualTo("a.wav");

    JsonNode first = root.get("transitions").get(0);
    assertThat(first.get("from").asText()).isEqualTo("a.wav");
    assertThat(first.get("to").asText()).isEqualTo("b.wav");
    assertThat(first.get("mix").asText()).isEqualTo("set.wav");
    assertThat(first.get("sourceEnd").asDouble()).isEqualTo(205.0);
    assertThat(first.get("targetStart").asDouble()).isEqualTo(210.0);
    assertThat(first.get("fromOffset").asDouble()).isEqualTo(12.5);
    assertThat(first.get("toOffset").asDouble()).isEqualTo(98.0);
  }

  @Test
  void writeJson_shouldWriteNullOffsetsForHandMadeEdges() throws IOException {
    JsonNode second = objectMapper.readTree(writer.writeJson(plan())).get("transitions").get(1);

    assertThat(second.get("fromOffset").isNull()).isTrue();
    assertThat(second.get("toOffset").isNull()).isTrue();
  }

  @Test
  void writeJson_shouldCreateParentDirectories() throws IOException {
    Path target = tempDir.resolve("plans/nested/plan.json");

    writer.writeJson(TransitionPlan.empty(), target);

    JsonNode root = objectMapper.readTree(Files.readString(target));
    assertThat(root.get("songs").size()).isZero();
    assertThat(root.get("transitions").size()).isZero();
  }

  @Test
  void plan_shouldRequireOneEdgePerHop() {
    assertThatThrownBy(() -> new TransitionPlan(List.of("a", "b"), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
