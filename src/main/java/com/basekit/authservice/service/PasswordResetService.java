package com.basekit.authservice.service;

import com.basekit.authservice.dto.OtpStatus;

public interface PasswordResetService {

    /** Sends a reset code by SMS to a registered phone. */
    OtpStatus requestResetOtp(String phone);

    void resetWithOtp(String phone, String otp, String newPassword);

    /**
     * Mails a one-hour reset link. Returns normally for unknown emails so the
     * endpoint cannot be used to discover which addresses are registered.
     */
    void requestResetToken(String email);

    void resetWithToken(String token, String newPassword);
}
