package com.basekit.authservice.service;

import com.basekit.authservice.dto.OtpStatus;
import com.basekit.authservice.dto.SignupRequest;
import com.basekit.authservice.dto.SignupResponse;

public interface RegistrationService {

    /**
     * Creates the identity and tries to send a phone verification code. A failed
     * send does not undo the signup; the response then asks for a resend.
     */
    SignupResponse signup(SignupRequest request);

    void verifyPhone(String phone, String otp);

    OtpStatus resendVerificationOtp(String phone);

    OtpStatus requestEmailVerificationOtp(String email);

    void verifyEmail(String email, String otp);
}
