package com.scholary.mix.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MixAnalyzerApplication {

  public static void main(String[] args) {
    SpringApplication.run(MixAnalyzerApplication.class, args);
  }
}
