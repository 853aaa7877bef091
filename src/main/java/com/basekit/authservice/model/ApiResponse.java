package com.basekit.authservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Success envelope. {@code data} is absent when the whole outcome is the message
 * (e.g. "Password reset successfully"); {@code meta} only accompanies lists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        Instant timestamp,
        String requestId,
        String message,
        T data,
        PageMeta meta
) {}
