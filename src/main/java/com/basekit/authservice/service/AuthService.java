package com.basekit.authservice.service;

import com.basekit.authservice.dto.LoginRequest;
import com.basekit.authservice.dto.LoginResponse;
import com.basekit.authservice.dto.UserSummary;

import java.util.UUID;

public interface AuthService {

    /**
     * Phone + password login. Checks run in a fixed order: credentials (401, one
     * message for unknown phone and wrong password), then active (403), then
     * phone verified (403).
     */
    LoginResponse login(LoginRequest request);

    UserSummary currentUser(UUID userId);
}
