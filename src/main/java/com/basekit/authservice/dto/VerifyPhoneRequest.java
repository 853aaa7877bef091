package com.basekit.authservice.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyPhoneRequest(
        @NotBlank(message = "Phone is required") String phone,
        @NotBlank(message = "OTP is required") String otp
) {}
