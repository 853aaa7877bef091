package com.basekit.authservice.dto;

public record NotificationSendResult(
        String message,
        int totalRecipients,
        int successCount,
        int failureCount
) {}
