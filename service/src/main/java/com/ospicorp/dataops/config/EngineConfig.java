package com.ospicorp.dataops.config;

import com.ospicorp.dataops.semantic.ColumnClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean
  ColumnClassifier columnClassifier(
      @Value("${dataops.classifier.sample-size:1000}") int sampleSize) {
    return new ColumnClassifier(sampleSize);
  }
}
