package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.dto.OtpStatus;
import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.MailService;
import com.basekit.authservice.service.OtpService;
import com.basekit.authservice.service.PasswordResetService;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetServiceImpl implements PasswordResetService {

    static final String INVALID_TOKEN = "Invalid or expired reset token";
    private static final int TOKEN_BYTES = 32;

    private final UserRepository userRepository;
    private final OtpService otpService;
    private final PasswordService passwordService;
    private final MailService mailService;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();

    @Value("${app.password-reset.token-ttl-minutes:60}")
    private long resetTokenTtlMinutes = 60;

    @Override
    public OtpStatus requestResetOtp(String phone) {
        User user = findByPhone(phone);
        otpService.issue(user, OtpPurpose.PASSWORD_RESET);
        log.info("Password reset OTP issued userId={}", user.getId());
        return otpService.status(user);
    }

    @Override
    public void resetWithOtp(String phone, String otp, String newPassword) {
        User user = findByPhone(phone);
        otpService.consume(user, OtpPurpose.PASSWORD_RESET, otp);
        passwordService.applyNewPassword(user, newPassword);
        userRepository.save(user);
        log.info("Password reset via OTP userId={}", user.getId());
    }

    @Override
    public void requestResetToken(String email) {
        Optional<User> found = StringUtils.hasText(email)
                ? userRepository.findByEmail(email.trim().toLowerCase(Locale.ROOT))
                : Optional.empty();
        if (found.isEmpty()) {
            log.debug("Password reset link requested for unknown email");
            return;
        }

        User user = found.get();
        final String token = generateToken();
        user.setResetPasswordToken(token);
        user.setResetPasswordExpires(clock.instant().plus(Duration.ofMinutes(resetTokenTtlMinutes)));
        User saved = userRepository.save(user);

        mailService.sendResetToken(saved.getEmail(), token, saved.getFirstName());
        log.info("Password reset link sent userId={}", saved.getId());
    }

    @Override
    public void resetWithToken(String token, String newPassword) {
        if (!StringUtils.hasText(token)) {
            throw new RequestExceptions.BadRequest(INVALID_TOKEN);
        }
        final Instant now = clock.instant();
        User user = userRepository.findFirstByResetPasswordTokenAndResetPasswordExpiresAfter(token, now)
                .orElseThrow(() -> new RequestExceptions.BadRequest(INVALID_TOKEN));

        passwordService.applyNewPassword(user, newPassword);
        userRepository.save(user);
        log.info("Password reset via link userId={}", user.getId());
    }

    // -------------------- helpers --------------------

    private User findByPhone(String rawPhone) {
        return phoneNumberNormalizer.normalize(rawPhone)
                .flatMap(userRepository::findByPhone)
                .orElseThrow(() -> new RequestExceptions.BadRequest("User not found"));
    }

    private String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
