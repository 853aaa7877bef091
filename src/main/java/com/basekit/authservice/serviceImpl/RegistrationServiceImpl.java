package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.dto.OtpStatus;
import com.basekit.authservice.dto.PhoneValidationResult;
import com.basekit.authservice.dto.SignupRequest;
import com.basekit.authservice.dto.SignupResponse;
import com.basekit.authservice.dto.UserSummary;
import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.entity.UserRole;
import com.basekit.authservice.exception.OtpExceptions;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.exception.UserExceptions;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.OtpService;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.service.RegistrationService;
import com.basekit.authservice.service.SmsService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationServiceImpl implements RegistrationService {

    static final String SIGNUP_OK =
            "User created successfully. Please verify your phone number with the OTP sent to your phone.";
    static final String SIGNUP_OTP_FAILED =
            "User created successfully, but OTP sending failed. Please try to resend OTP.";

    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final OtpService otpService;
    private final SmsService smsService;
    private final PhoneNumberNormalizer phoneNumberNormalizer;

    @Override
    public SignupResponse signup(SignupRequest request) {
        PhoneValidationResult phoneCheck = smsService.validatePhoneNumber(request.getPhone());
        if (!phoneCheck.valid()) {
            throw new RequestExceptions.InvalidParameter(phoneCheck.error());
        }
        final String phone = phoneCheck.formattedNumber();
        final String email = normalizeEmail(request.getEmail());

        // phone first, then email
        if (userRepository.existsByPhone(phone)) {
            throw new UserExceptions.UserAlreadyExists("User with this phone number already exists");
        }
        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.UserAlreadyExists("User with this email already exists");
        }

        User user = User.builder()
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .email(email)
                .phone(phone)
                .password(passwordService.hash(request.getPassword()))
                .role(UserRole.USER)
                .active(true)
                .phoneVerified(false)
                .emailVerified(true)
                .build();
        User saved = userRepository.save(user);
        log.info("User registered userId={}", saved.getId());

        // Best effort: the account exists whether or not the code goes out
        try {
            otpService.issue(saved, OtpPurpose.PHONE_VERIFICATION);
            return SignupResponse.builder()
                    .message(SIGNUP_OK)
                    .otpSent(true)
                    .user(UserSummary.from(saved))
                    .otp(otpService.status(saved))
                    .build();
        } catch (RuntimeException e) {
            log.warn("Signup completed without verification OTP userId={}: {}", saved.getId(), e.getMessage());
            return SignupResponse.builder()
                    .message(SIGNUP_OTP_FAILED)
                    .otpSent(false)
                    .user(UserSummary.from(saved))
                    .build();
        }
    }

    @Override
    public void verifyPhone(String phone, String otp) {
        User user = findByPhone(phone);
        if (user.isPhoneVerified()) {
            throw new OtpExceptions.AlreadyVerified(OtpPurpose.PHONE_VERIFICATION.alreadyVerifiedMessage());
        }
        otpService.consume(user, OtpPurpose.PHONE_VERIFICATION, otp);
        userRepository.save(user);
        log.info("Phone verified userId={}", user.getId());
    }

    @Override
    public OtpStatus resendVerificationOtp(String phone) {
        User user = findByPhone(phone);
        otpService.issue(user, OtpPurpose.PHONE_VERIFICATION);
        return otpService.status(user);
    }

    @Override
    public OtpStatus requestEmailVerificationOtp(String email) {
        User user = findByEmail(email);
        otpService.issue(user, OtpPurpose.EMAIL_VERIFICATION);
        return otpService.status(user);
    }

    @Override
    public void verifyEmail(String email, String otp) {
        User user = findByEmail(email);
        if (user.isEmailVerified()) {
            throw new OtpExceptions.AlreadyVerified(OtpPurpose.EMAIL_VERIFICATION.alreadyVerifiedMessage());
        }
        otpService.consume(user, OtpPurpose.EMAIL_VERIFICATION, otp);
        userRepository.save(user);
        log.info("Email verified userId={}", user.getId());
    }

    // -------------------- helpers --------------------

    private User findByPhone(String rawPhone) {
        return phoneNumberNormalizer.normalize(rawPhone)
                .flatMap(userRepository::findByPhone)
                .orElseThrow(() -> new RequestExceptions.BadRequest("User not found"));
    }

    private User findByEmail(String rawEmail) {
        return userRepository.findByEmail(normalizeEmail(rawEmail))
                .orElseThrow(() -> new RequestExceptions.BadRequest("User not found"));
    }

    private String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new RequestExceptions.InvalidParameter("Email must be provided.");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
