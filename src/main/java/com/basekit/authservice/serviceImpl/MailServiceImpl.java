package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.config.OtpProperties;
import com.basekit.authservice.entity.MarketingCategory;
import com.basekit.authservice.exception.ExternalExceptions;
import com.basekit.authservice.service.MailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MailServiceImpl implements MailService {

    private final JavaMailSender mailSender;
    private final OtpProperties otpProperties;

    @Value("${app.mail.from:no-reply@basekit.dev}")
    private String from;

    @Value("${app.password-reset.link-base-url:http://localhost:3000/reset-password?token=}")
    private String resetLinkBaseUrl;

    @Value("${app.password-reset.token-ttl-minutes:60}")
    private long resetTokenTtlMinutes;

    @Override
    public void sendResetToken(String to, String token, String firstName) {
        send(to, "Reset your password",
                "Hi " + firstName + ",\n\n"
                        + "Use the link below to choose a new password. It is valid for "
                        + resetTokenTtlMinutes + " minutes.\n\n"
                        + resetLinkBaseUrl + token + "\n\n"
                        + "If you did not request a reset, you can ignore this email.");
    }

    @Override
    public void sendEmailVerificationOtp(String to, String code, String firstName) {
        send(to, "Your verification code",
                "Hi " + firstName + ",\n\nYour email verification code is " + code
                        + ". It will expire in " + otpProperties.ttlMinutes() + " minutes.");
    }

    @Override
    public void sendMarketingEmail(String to, String title, String content, MarketingCategory category) {
        send(to, title, content + "\n\n--\nYou receive " + category.name().toLowerCase().replace('_', ' ')
                + " emails because you opted in. Update your preferences in your account settings.");
    }

    private void send(String to, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            mailSender.send(message);
            log.debug("Mail sent to={} subject={}", to, subject);
        } catch (MailException e) {
            log.warn("Mail delivery failed to={} subject={}: {}", to, subject, e.getMessage());
            throw new ExternalExceptions.DeliveryFailed("Failed to send email. Please try again later.", e);
        }
    }
}
