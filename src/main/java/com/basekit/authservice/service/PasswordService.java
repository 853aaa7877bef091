package com.basekit.authservice.service;

import com.basekit.authservice.entity.User;

public interface PasswordService {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String passwordHash);

    /**
     * Stores the hash of {@code rawPassword} and clears every outstanding reset
     * credential (reset OTP slot and reset link token) on the same entity.
     */
    void applyNewPassword(User user, String rawPassword);
}
