package com.basekit.authservice.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * One-time-code policy, bound from {@code app.otp.*}.
 *
 * @param ttlMinutes          lifetime of an issued code
 * @param dailyLimit          codes per identity per calendar day, across all purposes
 * @param minIntervalMinutes  minimum gap between two codes for the same identity
 */
@Validated
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        @DefaultValue("10") @Min(1) int ttlMinutes,
        @DefaultValue("3") @Min(1) int dailyLimit,
        @DefaultValue("5") @Min(0) int minIntervalMinutes
) {}
