package com.basekit.authservice.config;

import com.basekit.authservice.service.SmsService;
import com.basekit.authservice.serviceImpl.LoggingSmsServiceImpl;
import com.basekit.authservice.serviceImpl.TwilioSmsServiceImpl;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses the SMS gateway from {@code sms.provider}.
 * <p>
 * Supported providers:
 * - "log": writes the message to the application log (development, tests)
 * - "twilio": sends through the Twilio Messaging API
 */
@Slf4j
@Configuration
public class SmsConfig {

    @Bean
    @ConditionalOnProperty(name = "sms.provider", havingValue = "log", matchIfMissing = true)
    public SmsService loggingSmsService(PhoneNumberNormalizer phoneNumberNormalizer, OtpProperties otpProperties) {
        log.info("Configuring log-only SMS service; messages are not delivered");
        return new LoggingSmsServiceImpl(phoneNumberNormalizer, otpProperties);
    }

    /**
     * Numbers listed in {@code sms.allowlist} skip the Twilio call,
     * so QA accounts can register in any environment.
     */
    @Bean
    @ConditionalOnProperty(name = "sms.provider", havingValue = "twilio")
    public SmsService twilioSmsService(PhoneNumberNormalizer phoneNumberNormalizer,
                                       OtpProperties otpProperties,
                                       @Value("${sms.twilio.account-sid}") String accountSid,
                                       @Value("${sms.twilio.auth-token}") String authToken,
                                       @Value("${sms.twilio.from-number}") String fromNumber,
                                       @Value("${sms.allowlist:}") String allowlist) {
        log.info("Configuring Twilio SMS service from={}", fromNumber);
        Set<String> bypass = Arrays.stream(allowlist.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        return new TwilioSmsServiceImpl(phoneNumberNormalizer, otpProperties, accountSid, authToken, fromNumber, bypass);
    }
}
