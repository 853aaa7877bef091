package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.SecurityConfig.JwtTokenProviderConfig;
import com.basekit.authservice.dto.LoginRequest;
import com.basekit.authservice.dto.LoginResponse;
import com.basekit.authservice.dto.UserSummary;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.AuthExceptions;
import com.basekit.authservice.exception.UserExceptions;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.AuthService;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final JwtTokenProviderConfig jwtTokenProvider;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        Objects.requireNonNull(request, "request is required");

        User user = phoneNumberNormalizer.normalize(request.getLogin())
                .flatMap(userRepository::findByPhone)
                .orElseThrow(() -> {
                    log.debug("Login rejected: unknown phone");
                    return new AuthExceptions.Unauthorized(INVALID_CREDENTIALS);
                });

        if (!passwordService.matches(request.getPassword(), user.getPassword())) {
            log.debug("Login rejected: bad password userId={}", user.getId());
            throw new AuthExceptions.Unauthorized(INVALID_CREDENTIALS);
        }
        if (!user.isActive()) {
            throw new AuthExceptions.Forbidden("Your account has been deactivated");
        }
        if (!user.isPhoneVerified()) {
            throw new AuthExceptions.Forbidden("Please verify your phone number before logging in");
        }

        String accessToken = jwtTokenProvider.generateToken(user);
        log.info("Login success for userId={}", user.getId());

        return LoginResponse.builder()
                .accessToken(accessToken)
                .expiresIn(jwtTokenProvider.getTokenValiditySeconds())
                .issuedAt(Instant.now(clock))
                .user(UserSummary.from(user))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public UserSummary currentUser(UUID userId) {
        return userRepository.findById(userId)
                .map(UserSummary::from)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));
    }
}
