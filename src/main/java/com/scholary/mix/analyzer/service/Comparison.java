package com.scholary.mix.analyzer.service;

import java.nio.file.Path;

/** One song to look for in one mix. */
public record Comparison(Path songPath, Path mixPath) {}
