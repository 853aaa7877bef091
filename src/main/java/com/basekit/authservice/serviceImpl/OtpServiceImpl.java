package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.config.OtpProperties;
import com.basekit.authservice.dto.OtpStatus;
import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.ExternalExceptions;
import com.basekit.authservice.exception.OtpExceptions;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.exception.ResourceExceptions;
import com.basekit.authservice.model.IssuedOtp;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.MailService;
import com.basekit.authservice.service.OtpService;
import com.basekit.authservice.service.SmsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * OTP engine over the slots stored on {@link User}.
 * <p>
 * Issue order: already-verified guard, minimum interval, lazy calendar-day reset of
 * the counter, daily cap. The counter and last-request time are per identity, so all
 * three slots draw on one budget. The code is committed before it is sent, so it
 * stays valid when sending fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OtpServiceImpl implements OtpService {

    private static final int CODE_MIN = 100_000;
    private static final int CODE_BOUND = 1_000_000;

    private final UserRepository userRepository;
    private final SmsService smsService;
    private final MailService mailService;
    private final OtpProperties otpProperties;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();

    // ==== Public API ====

    @Override
    public IssuedOtp issue(User user, OtpPurpose purpose) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(purpose, "purpose");
        final Instant now = clock.instant();

        if (purpose.isAlreadyVerified(user)) {
            throw new OtpExceptions.AlreadyVerified(purpose.alreadyVerifiedMessage());
        }
        enforceMinInterval(user, now);

        resetCounterIfNewDay(user, now);
        // a freshly reset counter is zero, so only a same-day count can hit the cap
        if (user.getOtpRequestCount() >= otpProperties.dailyLimit()) {
            log.debug("Daily OTP cap reached userId={} purpose={}", user.getId(), purpose);
            throw new RequestExceptions.RateLimited(
                    "You have exceeded the maximum number of OTP requests (" + otpProperties.dailyLimit() + ") for today");
        }

        final String code = generateCode();
        final Instant expiresAt = now.plus(Duration.ofMinutes(otpProperties.ttlMinutes()));
        purpose.store(user, code, expiresAt);
        user.setLastOtpRequestTime(now);
        user.setOtpRequestCount(user.getOtpRequestCount() + 1);

        User saved = persist(user);
        dispatch(saved, purpose, code);

        log.info("OTP issued userId={} purpose={} channel={} count={}/{}",
                saved.getId(), purpose, purpose.channel(), saved.getOtpRequestCount(), otpProperties.dailyLimit());
        return new IssuedOtp(purpose, code, expiresAt);
    }

    @Override
    public void consume(User user, OtpPurpose purpose, String submittedCode) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(purpose, "purpose");

        final String stored = purpose.code(user);
        final Instant expiresAt = purpose.expiresAt(user);
        if (stored == null || expiresAt == null) {
            throw new OtpExceptions.OtpNotFound();
        }
        // A code is dead at its expiry instant, not one tick after
        if (!expiresAt.isAfter(clock.instant())) {
            throw new OtpExceptions.OtpExpired();
        }
        if (!stored.equals(submittedCode)) {
            throw new OtpExceptions.OtpMismatch();
        }

        purpose.clear(user);
        purpose.applyConsumed(user);
        log.debug("OTP consumed userId={} purpose={}", user.getId(), purpose);
    }

    @Override
    public OtpStatus status(User user) {
        final Instant now = clock.instant();
        final Instant last = user.getLastOtpRequestTime();

        int used = (last != null && sameDay(last, now)) ? user.getOtpRequestCount() : 0;
        Instant next = null;
        if (last != null) {
            Instant allowedAt = last.plus(Duration.ofMinutes(otpProperties.minIntervalMinutes()));
            if (allowedAt.isAfter(now)) next = allowedAt;
        }
        return new OtpStatus(used, otpProperties.dailyLimit(), next, otpProperties.ttlMinutes());
    }

    // ==== Guards ====

    private void enforceMinInterval(User user, Instant now) {
        final Instant last = user.getLastOtpRequestTime();
        if (last == null) return;

        Duration minInterval = Duration.ofMinutes(otpProperties.minIntervalMinutes());
        Duration elapsed = Duration.between(last, now);
        if (elapsed.compareTo(minInterval) < 0) {
            long waitMillis = minInterval.minus(elapsed).toMillis();
            long waitMinutes = (waitMillis + 59_999) / 60_000;
            log.debug("OTP interval not elapsed userId={} waitMinutes={}", user.getId(), waitMinutes);
            throw new RequestExceptions.RateLimited(
                    "Please wait " + waitMinutes + " minute(s) before requesting another OTP");
        }
    }

    /** Resets the counter in memory when the last request fell on an earlier calendar day. */
    private void resetCounterIfNewDay(User user, Instant now) {
        final Instant last = user.getLastOtpRequestTime();
        if (last != null && !sameDay(last, now)) {
            user.setOtpRequestCount(0);
        }
    }

    private boolean sameDay(Instant a, Instant b) {
        LocalDate dayA = LocalDate.ofInstant(a, clock.getZone());
        LocalDate dayB = LocalDate.ofInstant(b, clock.getZone());
        return dayA.equals(dayB);
    }

    // ==== Helpers ====

    private String generateCode() {
        return String.valueOf(random.nextInt(CODE_MIN, CODE_BOUND));
    }

    private User persist(User user) {
        try {
            return userRepository.save(user);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Concurrent OTP request lost the race userId={}", user.getId());
            throw new ResourceExceptions.Conflict("Another request for this account was processed at the same time. Please retry.");
        }
    }

    private void dispatch(User user, OtpPurpose purpose, String code) {
        try {
            switch (purpose) {
                case PHONE_VERIFICATION -> smsService.sendPhoneVerificationOtp(user.getPhone(), code, user.getFirstName());
                case PASSWORD_RESET -> smsService.sendPasswordResetOtp(user.getPhone(), code, user.getFirstName());
                case EMAIL_VERIFICATION -> mailService.sendEmailVerificationOtp(user.getEmail(), code, user.getFirstName());
            }
        } catch (ExternalExceptions.DeliveryFailed e) {
            log.warn("OTP stored but not delivered userId={} purpose={}: {}", user.getId(), purpose, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("OTP stored but not delivered userId={} purpose={}", user.getId(), purpose, e);
            throw new ExternalExceptions.DeliveryFailed("Failed to send OTP. Please try again later.", e);
        }
    }
}
