package com.scholary.mix.analyzer.matching;

import org.springframework.stereotype.Component;

/** Keeps the rough window: the whole song placed at the best cross-correlation frame. */
@Component
public class RoughOnlyRefinementStrategy implements RefinementStrategy {

  @Override
  public RefinedMatch refine(RefinementContext context) {
    return RefinedMatch.fromWindow(context.roughWindow(), MatchStatus.MATCHED);
  }

  @Override
  public RefinementMode mode() {
    return RefinementMode.ROUGH;
  }

  @Override
  public String getStrategyName() {
    return "rough-only";
  }
}
