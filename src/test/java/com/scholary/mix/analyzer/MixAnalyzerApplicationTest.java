package com.scholary.mix.analyzer;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.mix.analyzer.fingerprint.DiskFingerprintCache;
import com.scholary.mix.analyzer.fingerprint.FingerprintCache;
import com.scholary.mix.analyzer.graph.BeamSearchPathSelector;
import com.scholary.mix.analyzer.graph.PathSelector;
import com.scholary.mix.analyzer.matching.RefinementMode;
import com.scholary.mix.analyzer.matching.RefinementStrategy;
import com.scholary.mix.analyzer.service.MixAnalysisService;
import com.scholary.mix.analyzer.service.TransitionPlanner;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "fingerprint.cacheDir=${java.io.tmpdir}/mix-analyzer-test-cache")
class MixAnalyzerApplicationTest {

  @Autowired private MixAnalysisService mixAnalysisService;
  @Autowired private TransitionPlanner transitionPlanner;
  @Autowired private List<RefinementStrategy> strategies;
  @Autowired private PathSelector pathSelector;
  @Autowired private FingerprintCache fingerprintCache;

  @Test
  void contextLoads_withEveryRefinementModeRegistered() {
    assertThat(mixAnalysisService).isNotNull();
    assertThat(transitionPlanner).isNotNull();
    assertThat(strategies)
        .extracting(RefinementStrategy::mode)
        .containsExactlyInAnyOrder(RefinementMode.values());
    assertThat(pathSelector).isInstanceOf(BeamSearchPathSelector.class);
    assertThat(pathSelector.getSelectorName()).isEqualTo("beam(k=3)");
    assertThat(fingerprintCache).isInstanceOf(DiskFingerprintCache.class);
  }
}
