package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.dto.CreateUserRequest;
import com.basekit.authservice.dto.PhoneValidationResult;
import com.basekit.authservice.dto.UpdateUserRequest;
import com.basekit.authservice.dto.UserSummary;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.entity.UserRole;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.exception.ResourceExceptions;
import com.basekit.authservice.exception.UserExceptions;
import com.basekit.authservice.repository.UserMarketingPreferenceRepository;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.service.UserService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;
    private final UserMarketingPreferenceRepository preferenceRepository;
    private final PasswordService passwordService;
    private final PhoneNumberNormalizer phoneNumberNormalizer;

    @Override
    @Transactional(readOnly = true)
    public Page<UserSummary> findAll(Pageable pageable) {
        return userRepository.findAll(pageable).map(UserSummary::from);
    }

    @Override
    @Transactional(readOnly = true)
    public UserSummary findOne(UUID id) {
        return UserSummary.from(load(id));
    }

    @Override
    @Transactional
    public UserSummary create(CreateUserRequest request) {
        User user = User.builder()
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .email(normalizeEmail(request.getEmail()))
                .phone(normalizePhone(request.getPhone()))
                .password(passwordService.hash(request.getPassword()))
                .role(request.getRole() == null ? UserRole.USER : request.getRole())
                .active(true)
                .phoneVerified(request.isPhoneVerified())
                .emailVerified(request.isEmailVerified())
                .build();
        User saved = saveAndFlush(user);
        log.info("User created by admin userId={} role={}", saved.getId(), saved.getRole());
        return UserSummary.from(saved);
    }

    @Override
    @Transactional
    public UserSummary update(UUID id, UpdateUserRequest request) {
        User user = load(id);
        final String previousEmail = user.getEmail();

        if (request.getFirstName() != null) user.setFirstName(request.getFirstName().trim());
        if (request.getLastName() != null) user.setLastName(request.getLastName().trim());
        if (request.getEmail() != null) user.setEmail(normalizeEmail(request.getEmail()));
        if (request.getPhone() != null) user.setPhone(normalizePhone(request.getPhone()));
        if (request.getPassword() != null) user.setPassword(passwordService.hash(request.getPassword()));
        if (request.getRole() != null) user.setRole(request.getRole());
        if (request.getActive() != null) user.setActive(request.getActive());
        if (request.getPhoneVerified() != null) user.setPhoneVerified(request.getPhoneVerified());
        if (request.getEmailVerified() != null) user.setEmailVerified(request.getEmailVerified());

        User saved = saveAndFlush(user);
        if (!Objects.equals(saved.getEmail(), previousEmail)) {
            syncPreferenceEmail(saved);
        }
        log.info("User updated by admin userId={}", saved.getId());
        return UserSummary.from(saved);
    }

    @Override
    @Transactional
    public void remove(UUID id) {
        if (!userRepository.existsById(id)) {
            throw notFound(id);
        }
        preferenceRepository.deleteByUserId(id);
        userRepository.deleteById(id);
        log.info("User deleted by admin userId={}", id);
    }

    // -------------------- helpers --------------------

    private User load(UUID id) {
        return userRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    // marketing mail goes to the preference row's copy of the address
    private void syncPreferenceEmail(User user) {
        preferenceRepository.findByUserId(user.getId()).ifPresent(pref -> {
            pref.setEmail(user.getEmail());
            preferenceRepository.save(pref);
            log.debug("Marketing preference email synced userId={}", user.getId());
        });
    }

    private UserExceptions.UserNotFound notFound(UUID id) {
        return new UserExceptions.UserNotFound("User with ID " + id + " not found");
    }

    private User saveAndFlush(User user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.debug("Unique constraint hit: {}", e.getMostSpecificCause().getMessage());
            throw new ResourceExceptions.Conflict("A user with this email or phone number already exists");
        }
    }

    private String normalizePhone(String raw) {
        PhoneValidationResult result = phoneNumberNormalizer.validate(raw);
        if (!result.valid()) {
            throw new RequestExceptions.InvalidParameter(result.error());
        }
        return result.formattedNumber();
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
