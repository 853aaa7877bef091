package com.basekit.authservice.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.UUID;

/**
 * Per-user opt-ins for marketing mail. Subscriptions default to on, channel
 * preference defaults to email only.
 */
@Entity
@Table(name = "user_marketing_preferences")
@NoArgsConstructor
@Getter
@Setter
@SuperBuilder
public class UserMarketingPreference extends BaseEntity {

    @Column(name = "user_id", nullable = false, unique = true, length = 36)
    @JdbcTypeCode(SqlTypes.CHAR)
    private UUID userId;

    @Column(nullable = false, length = 100)
    private String email;

    @Builder.Default
    @Column(name = "subscribed_promotional", nullable = false)
    private boolean subscribedToPromotional = true;

    @Builder.Default
    @Column(name = "subscribed_newsletter", nullable = false)
    private boolean subscribedToNewsletter = true;

    @Builder.Default
    @Column(name = "subscribed_product_updates", nullable = false)
    private boolean subscribedToProductUpdates = true;

    @Builder.Default
    @Column(name = "subscribed_events", nullable = false)
    private boolean subscribedToEvents = true;

    @Builder.Default
    @Column(name = "prefer_email", nullable = false)
    private boolean preferEmail = true;

    @Builder.Default
    @Column(name = "prefer_sms", nullable = false)
    private boolean preferSms = false;

    @Builder.Default
    @Column(name = "prefer_push", nullable = false)
    private boolean preferPush = false;

    public boolean isSubscribedTo(MarketingCategory category) {
        return switch (category) {
            case PROMOTIONAL -> subscribedToPromotional;
            case NEWSLETTER -> subscribedToNewsletter;
            case PRODUCT_UPDATES -> subscribedToProductUpdates;
            case EVENTS -> subscribedToEvents;
        };
    }
}
