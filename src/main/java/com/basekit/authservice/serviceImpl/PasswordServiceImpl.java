package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.service.PasswordService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;

@Service
@RequiredArgsConstructor
public class PasswordServiceImpl implements PasswordService {

    // BCrypt only reads the first 72 bytes and the encoder refuses anything longer
    static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;

    @Override
    public String hash(String rawPassword) {
        if (!StringUtils.hasText(rawPassword)) {
            throw new IllegalArgumentException("Password must be provided.");
        }
        if (tooLong(rawPassword)) {
            throw new RequestExceptions.InvalidParameter("Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(rawPassword);
    }

    @Override
    public boolean matches(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null) return false;
        // nothing longer can ever have been stored
        if (tooLong(rawPassword)) return false;
        return passwordEncoder.matches(rawPassword, passwordHash);
    }

    @Override
    public void applyNewPassword(User user, String rawPassword) {
        user.setPassword(hash(rawPassword));
        OtpPurpose.PASSWORD_RESET.clear(user);
        user.setResetPasswordToken(null);
        user.setResetPasswordExpires(null);
    }

    private boolean tooLong(String rawPassword) {
        return rawPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
