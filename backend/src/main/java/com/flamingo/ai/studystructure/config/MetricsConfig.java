package com.flamingo.ai.studystructure.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring. Extraction is timed as {@code structure.extract}; the boundary policy counter
 * {@code structure.boundaries} is registered directly by the extractor.
 */
@Configuration
public class MetricsConfig {

  /** Backs {@code @Timed} on the extraction entry point with the application's registry. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
