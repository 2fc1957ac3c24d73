/*
 * Where: shared configuration
 * What: Exposes the injectable Clock
 * Why: Services read "now" only through this bean so tests can pin time
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // Always UTC; local calendar dates are derived with an explicit ZoneId where needed
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
