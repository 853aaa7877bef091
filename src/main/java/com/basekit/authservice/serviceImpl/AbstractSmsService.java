package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.config.OtpProperties;
import com.basekit.authservice.dto.PhoneValidationResult;
import com.basekit.authservice.service.SmsService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;

/** Message wording and number validation shared by every SMS gateway. */
public abstract class AbstractSmsService implements SmsService {

    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final OtpProperties otpProperties;

    protected AbstractSmsService(PhoneNumberNormalizer phoneNumberNormalizer, OtpProperties otpProperties) {
        this.phoneNumberNormalizer = phoneNumberNormalizer;
        this.otpProperties = otpProperties;
    }

    @Override
    public void sendPhoneVerificationOtp(String phone, String code, String firstName) {
        deliver(phone, "phone-verification", "Hi " + firstName + ", your verification code is " + code
                + ". It expires in " + otpProperties.ttlMinutes() + " minutes.");
    }

    @Override
    public void sendPasswordResetOtp(String phone, String code, String firstName) {
        deliver(phone, "password-reset", "Hi " + firstName + ", your password reset code is " + code
                + ". It expires in " + otpProperties.ttlMinutes() + " minutes. Ignore this message if you did not ask for it.");
    }

    @Override
    public PhoneValidationResult validatePhoneNumber(String rawPhone) {
        return phoneNumberNormalizer.validate(rawPhone);
    }

    /**
     * Sends {@code body} to an E.164 number. {@code purpose} is a short label safe
     * to log; the body carries a live code and must not reach production logs.
     */
    protected abstract void deliver(String phone, String purpose, String body);
}
