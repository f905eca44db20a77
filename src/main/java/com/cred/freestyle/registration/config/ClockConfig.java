package com.cred.freestyle.registration.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source for eligibility windows and lifecycle timestamps.
 * Tests replace it with a fixed clock to check window boundaries.
 *
 * @author Registration Team
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
