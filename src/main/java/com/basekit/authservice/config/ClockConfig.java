package com.basekit.authservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Optional;

@Slf4j
@Configuration
public class ClockConfig {

    /**
     * Single time source for token lifetimes, OTP expiry and the daily OTP budget.
     * The zone decides where a calendar day starts.
     */
    @Bean
    public Clock clock(@Value("${app.time-zone:}") String timeZone) {
        ZoneId zone = StringUtils.hasText(timeZone) ? ZoneId.of(timeZone) : ZoneId.systemDefault();
        log.info("Application clock zone={}", zone);
        return Clock.system(zone);
    }

    /** Audit columns are stamped from the same clock. */
    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(clock.instant());
    }
}
