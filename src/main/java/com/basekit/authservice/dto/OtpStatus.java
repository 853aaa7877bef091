package com.basekit.authservice.dto;

import java.time.Instant;

/**
 * Remaining OTP budget for one identity.
 *
 * @param used                 codes issued today
 * @param max                  daily cap
 * @param nextRequestAllowedAt earliest instant another code may be requested, null when no wait applies
 * @param ttlMinutes           lifetime of a freshly issued code
 */
public record OtpStatus(
        int used,
        int max,
        Instant nextRequestAllowedAt,
        int ttlMinutes
) {
    public int remaining() {
        return Math.max(0, max - used);
    }
}
