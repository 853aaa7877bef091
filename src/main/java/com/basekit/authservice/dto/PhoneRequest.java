package com.basekit.authservice.dto;

import jakarta.validation.constraints.NotBlank;

public record PhoneRequest(
        @NotBlank(message = "Phone is required") String phone
) {}
