package com.basekit.authservice.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

@Entity
@Table(name = "marketing_notifications")
@NoArgsConstructor
@Getter
@Setter
@SuperBuilder
public class MarketingNotification extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 5000)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private MarketingCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private NotificationTiming timing = NotificationTiming.IMMEDIATE;

    @Column(name = "scheduled_date")
    private Instant scheduledDate;

    @Builder.Default
    @Column(name = "is_sent", nullable = false)
    private boolean sent = false;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Builder.Default
    @Column(name = "success_count", nullable = false)
    private int successCount = 0;

    @Builder.Default
    @Column(name = "failure_count", nullable = false)
    private int failureCount = 0;
}
