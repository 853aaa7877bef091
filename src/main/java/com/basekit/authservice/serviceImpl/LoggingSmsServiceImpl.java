package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.config.OtpProperties;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Development gateway: writes messages, codes included, to the log instead of
 * sending them. Only active with {@code sms.provider=log}.
 * <p>
 * Note: Bean is created by {@link com.basekit.authservice.config.SmsConfig}
 */
@Slf4j
public class LoggingSmsServiceImpl extends AbstractSmsService {

    public LoggingSmsServiceImpl(PhoneNumberNormalizer phoneNumberNormalizer, OtpProperties otpProperties) {
        super(phoneNumberNormalizer, otpProperties);
    }

    @Override
    protected void deliver(String phone, String purpose, String body) {
        log.info("[SMS:log] to={} purpose={} body={}", phone, purpose, body);
    }
}
