package dev.presscrawl.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} used for checkpoint timestamps, fetch times and the "today" bound of
 * daily archives.
 *
 * <p>{@code presscrawl.time-zone} sets the zone archive dates are read in (e.g.
 * {@code Asia/Kolkata}); the system zone is used when it is blank.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock(@Value("${presscrawl.time-zone:}") String timeZone) {
    return timeZone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(timeZone));
  }
}
