package com.scholary.mix.analyzer.matching;

import com.scholary.mix.analyzer.fingerprint.Fingerprint;
import java.nio.file.Path;

/**
 * Context for refinement strategies.
 *
 * <p>Contains all information needed to refine a rough match.
 */
public record RefinementContext(
    Path songPath, Path mixPath, Fingerprint song, Fingerprint mix, MatchWindow roughWindow) {}
