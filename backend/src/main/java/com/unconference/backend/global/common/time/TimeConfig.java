package com.unconference.backend.global.common.time;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The one clock of the service. Token expiry, the optimizer's time budget and the
 * {@code created_at}/{@code updated_at} audit columns all read it, so timeslot boundaries and audit
 * values stay in UTC and a test can pin them with {@link Clock#fixed}.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock scheduleClock() {
        return Clock.systemUTC();
    }
}
