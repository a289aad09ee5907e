/*
 * Where: Common configuration
 * What: Exposes the injectable Clock and the business WallClock
 * Why: Every component reads "now" through the same replaceable source
 */
package com.parcelsms.common.config;

import com.parcelsms.common.time.WallClock;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public WallClock wallClock(
      Clock clock, @Value("${notification.time-zone:Europe/Stockholm}") String timeZone) {
    return new WallClock(clock, ZoneId.of(timeZone));
  }
}
