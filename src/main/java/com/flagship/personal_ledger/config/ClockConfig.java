package com.flagship.personal_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Source of "today" for budget cycles, scheduled syncs and system-generated entries.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock(@Value("${ledger.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
