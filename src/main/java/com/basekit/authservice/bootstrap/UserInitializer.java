package com.basekit.authservice.bootstrap;

import com.basekit.authservice.entity.User;
import com.basekit.authservice.entity.UserRole;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Seeds one active, verified ADMIN so a fresh deployment can be administered.
 * Idempotent: skipped when the phone or email is already registered.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.init.enabled", havingValue = "true")
public class UserInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PhoneNumberNormalizer phoneNumberNormalizer;

    @Value("${app.init.admin.email}")
    private String adminEmail;

    @Value("${app.init.admin.phone}")
    private String adminPhone;

    @Value("${app.init.admin.password}")
    private String adminPlainPassword;

    @Override
    @Transactional
    public void run(String... args) {
        final String email = adminEmail.trim().toLowerCase(Locale.ROOT);
        final String phone = phoneNumberNormalizer.normalize(adminPhone)
                .orElseThrow(() -> new IllegalStateException("app.init.admin.phone is not a valid phone number"));

        if (userRepository.existsByEmail(email) || userRepository.existsByPhone(phone)) {
            log.info("Admin '{}' already present, skipping bootstrap.", email);
            return;
        }

        User admin = User.builder()
                .firstName("Admin")
                .lastName("User")
                .email(email)
                .phone(phone)
                .password(ensureEncoded(adminPlainPassword))
                .role(UserRole.ADMIN)
                .active(true)
                .phoneVerified(true)
                .emailVerified(true)
                .build();
        User saved = userRepository.save(admin);
        log.info("Admin '{}' added successfully id={}", email, saved.getId());
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (rawOrEncoded == null) throw new IllegalArgumentException("Password cannot be null");
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return passwordEncoder.encode(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }
}
