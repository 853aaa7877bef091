package com.basekit.authservice.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record ScheduleNotificationRequest(
        @NotNull(message = "Scheduled date is required") Instant scheduledDate
) {}
