package com.basekit.authservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordOtpRequest(
        @NotBlank(message = "Phone is required") String phone,
        @NotBlank(message = "OTP is required") String otp,
        @NotBlank(message = "New password is required")
        @Size(min = 8, max = 72, message = "Password must be between 8 and 72 characters")
        String newPassword
) {}
