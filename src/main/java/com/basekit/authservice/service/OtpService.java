package com.basekit.authservice.service;

import com.basekit.authservice.dto.OtpStatus;
import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.model.IssuedOtp;

public interface OtpService {

    /**
     * Generates a 6-digit code for the given slot, applies the interval and daily
     * limits shared by all slots, persists it together with the counters and hands it
     * to the purpose's channel.
     *
     * @throws com.basekit.authservice.exception.OtpExceptions.AlreadyVerified when the slot's flag is already set
     * @throws com.basekit.authservice.exception.RequestExceptions.RateLimited  when the interval or daily cap blocks the request
     * @throws com.basekit.authservice.exception.ExternalExceptions.DeliveryFailed when the code was stored but could not be sent
     */
    IssuedOtp issue(User user, OtpPurpose purpose);

    /**
     * Checks {@code submittedCode} against the slot. On success clears the slot and
     * applies the purpose's side effect to {@code user} in memory; the caller saves.
     */
    void consume(User user, OtpPurpose purpose, String submittedCode);

    /** Current request budget for the identity. */
    OtpStatus status(User user);
}
