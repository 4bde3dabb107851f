package com.scholary.mix.analyzer.matching;

/**
 * Strategy interface for refining a rough match.
 *
 * <p>Different strategies trade accuracy for cost:
 *
 * <ul>
 *   <li>Rough-only: keep the cross-correlation window
 *   <li>Chunk isometry: match song chunks individually and keep the consistent ones
 *   <li>Beat alignment: snap to the nearest downbeat
 * </ul>
 */
public interface RefinementStrategy {

  /**
   * Refine the rough window in the context.
   *
   * @param context fingerprints, paths and the rough window
   * @return the refined match; failures are reported through its status
   * @throws AnalysisTimeoutException if the work exceeds the configured budget
   */
  RefinedMatch refine(RefinementContext context);

  /**
   * The mode this strategy implements.
   *
   * @return refinement mode
   */
  RefinementMode mode();

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();
}
