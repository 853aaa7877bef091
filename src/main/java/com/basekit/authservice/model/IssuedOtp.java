package com.basekit.authservice.model;

import com.basekit.authservice.entity.OtpPurpose;

import java.time.Instant;

/** A code that has been stored and handed to its channel. Stays server-side. */
public record IssuedOtp(OtpPurpose purpose, String code, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedOtp[purpose=" + purpose + ", expiresAt=" + expiresAt + "]";
    }
}
