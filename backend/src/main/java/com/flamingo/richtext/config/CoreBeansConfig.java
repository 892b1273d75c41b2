package com.flamingo.richtext.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Infrastructure beans shared by the editing services. */
@Configuration
public class CoreBeansConfig {

  /**
   * Enables the @Timed annotation on editor service operations.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Time source for undo coalescing. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
