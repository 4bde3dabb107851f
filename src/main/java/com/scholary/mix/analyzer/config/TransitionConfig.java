package com.scholary.mix.analyzer.config;

import com.scholary.mix.analyzer.graph.BeamSearchPathSelector;
import com.scholary.mix.analyzer.graph.EdgeResolver;
import com.scholary.mix.analyzer.graph.ExhaustivePathSelector;
import com.scholary.mix.analyzer.graph.PathSelector;
import com.scholary.mix.analyzer.transition.TransitionProperties;
import com.scholary.mix.analyzer.transition.TransitionProperties.SelectorType;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transition planning.
 *
 * <p>Picks the path selector named by {@code transitions.selector}.
 */
@Configuration
@EnableConfigurationProperties(TransitionProperties.class)
public class TransitionConfig {

  @Bean
  public PathSelector pathSelector(TransitionProperties properties) {
    if (properties.selector() == SelectorType.EXHAUSTIVE) {
      return new ExhaustivePathSelector(properties.exhaustiveExpansionLimit());
    }
    return new BeamSearchPathSelector(properties.beamWidth());
  }

  @Bean
  public EdgeResolver edgeResolver() {
    return new EdgeResolver();
  }
}
