package com.basekit.authservice.repository;

import com.basekit.authservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    boolean existsByEmail(String email);

    boolean existsByPhone(String phone);

    Optional<User> findByEmail(String email);

    Optional<User> findByPhone(String phone);

    /** Matches only while the token is still unexpired; wrong and stale tokens look the same. */
    Optional<User> findFirstByResetPasswordTokenAndResetPasswordExpiresAfter(String token, Instant now);
}
