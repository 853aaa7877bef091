package com.basekit.authservice.service;

import com.basekit.authservice.dto.PhoneValidationResult;

/**
 * Outbound SMS gateway. Implementations throw
 * {@link com.basekit.authservice.exception.ExternalExceptions.DeliveryFailed}
 * when the provider rejects or cannot be reached.
 * <p>
 * Note: Bean is created by {@link com.basekit.authservice.config.SmsConfig}
 */
public interface SmsService {

    void sendPhoneVerificationOtp(String phone, String code, String firstName);

    void sendPasswordResetOtp(String phone, String code, String firstName);

    PhoneValidationResult validatePhoneNumber(String rawPhone);
}
