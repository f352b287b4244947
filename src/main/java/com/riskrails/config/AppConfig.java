package com.riskrails.config;

import com.riskrails.execution.Sleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time sources. Components take a {@link Clock} and a {@link Sleeper} instead of reading
 * the system clock or calling {@code Thread.sleep} directly, so tests can drive time.
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
