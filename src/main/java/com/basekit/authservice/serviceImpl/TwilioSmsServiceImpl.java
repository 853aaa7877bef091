package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.config.OtpProperties;
import com.basekit.authservice.exception.ExternalExceptions;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import com.twilio.Twilio;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Twilio Messaging API gateway.
 * <p>
 * Numbers in the allowlist bypass the API, so test accounts can be registered in
 * every environment without spending SMS credit. Only the recipient and purpose
 * are logged for them, never the message text.
 * <p>
 * Note: Bean is created by {@link com.basekit.authservice.config.SmsConfig}
 */
@Slf4j
public class TwilioSmsServiceImpl extends AbstractSmsService {

    private final PhoneNumber from;
    private final Set<String> allowlist;

    public TwilioSmsServiceImpl(PhoneNumberNormalizer phoneNumberNormalizer,
                                OtpProperties otpProperties,
                                String accountSid,
                                String authToken,
                                String fromNumber,
                                Set<String> allowlist) {
        super(phoneNumberNormalizer, otpProperties);
        this.from = new PhoneNumber(fromNumber);
        this.allowlist = Set.copyOf(allowlist);
        Twilio.init(accountSid, authToken);
        log.info("Twilio client initialized; {} allowlisted number(s)", this.allowlist.size());
    }

    @Override
    protected void deliver(String phone, String purpose, String body) {
        if (allowlist.contains(phone)) {
            log.info("[SMS:allowlist] skipped to={} purpose={}", phone, purpose);
            return;
        }
        try {
            Message message = Message.creator(new PhoneNumber(phone), from, body).create();
            log.info("SMS accepted by Twilio to={} purpose={} sid={} status={}", phone, purpose, message.getSid(), message.getStatus());
        } catch (TwilioException e) {
            log.error("Twilio rejected SMS to={} purpose={}: {}", phone, purpose, e.getMessage());
            throw new ExternalExceptions.DeliveryFailed("Failed to send SMS. Please try again later.", e);
        }
    }
}
