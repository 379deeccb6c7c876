package com.flamingo.ai.pagereader.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Shared infrastructure beans: method timing and the service clock. */
@Configuration
public class SupportConfig {

  /** Enables {@code @Timed} on service methods. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Ledger periods and cache expiry are computed in UTC. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
