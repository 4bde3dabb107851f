package com.scholary.mix.analyzer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mix.analyzer.graph.TransitionEdge;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes transition plans for the external renderer.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "songs": ["a.mp3", "b.mp3"],
 *   "transitions": [
 *     {"from": "a.mp3", "to": "b.mp3", "mix": "set.mp3",
 *      "sourceEnd": 215.4, "targetStart": 222.0, "fromOffset": 12.1, "toOffset": 222.0}
 *   ]
 * }
 * </pre>
 *
 * <p>All times are mix seconds; a song's own time is {@code mixTime - offset}.
 */
@Component
public class TransitionPlanWriter {

  private final ObjectMapper objectMapper;

  public TransitionPlanWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** A resolved hand-off as the renderer sees it. */
  public record TransitionView(
      String from,
      String to,
      String mix,
      double sourceEnd,
      double targetStart,
      Double fromOffset,
      Double toOffset) {

    static TransitionView of(TransitionEdge edge) {
      return new TransitionView(
          edge.source(),
          edge.target(),
          edge.mixId(),
          edge.sourceEnd(),
          edge.targetStart(),
          edge.pair() == null ? null : edge.pair().offsetX(),
          edge.pair() == null ? null : edge.pair().offsetY());
    }
  }

  public byte[] writeJson(TransitionPlan plan) throws IOException {
    List<TransitionView> transitions = new ArrayList<>();
    for (TransitionEdge edge : plan.edges()) {
      transitions.add(TransitionView.of(edge));
    }

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("songs", plan.songs());
    document.put("transitions", transitions);

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Write the plan to a file, replacing it if present.
   *
   * @return the file written
   */
  public Path writeJson(TransitionPlan plan, Path target) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(target, writeJson(plan));
    return target;
  }
}
