package com.basekit.authservice.dto;

import com.basekit.authservice.entity.MarketingCategory;
import com.basekit.authservice.entity.MarketingNotification;
import com.basekit.authservice.entity.NotificationTiming;

import java.time.Instant;
import java.util.UUID;

public record MarketingNotificationResponse(
        UUID id,
        String title,
        String content,
        MarketingCategory category,
        NotificationTiming timing,
        Instant scheduledDate,
        boolean sent,
        Instant sentAt,
        int successCount,
        int failureCount,
        Instant createdAt
) {
    public static MarketingNotificationResponse from(MarketingNotification n) {
        return new MarketingNotificationResponse(
                n.getId(),
                n.getTitle(),
                n.getContent(),
                n.getCategory(),
                n.getTiming(),
                n.getScheduledDate(),
                n.isSent(),
                n.getSentAt(),
                n.getSuccessCount(),
                n.getFailureCount(),
                n.getCreatedAt()
        );
    }
}
