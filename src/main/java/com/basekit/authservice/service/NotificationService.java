package com.basekit.authservice.service;

import com.basekit.authservice.dto.MarketingNotificationRequest;
import com.basekit.authservice.dto.MarketingNotificationResponse;
import com.basekit.authservice.dto.MarketingPreferenceRequest;
import com.basekit.authservice.dto.MarketingPreferenceResponse;
import com.basekit.authservice.dto.NotificationSendResult;
import com.basekit.authservice.entity.User;
import org.springframework.data.domain.Page;

import java.time.Instant;
import java.util.UUID;

public interface NotificationService {

    MarketingNotificationResponse create(MarketingNotificationRequest request);

    /** Newest first; {@code page} is 1-based. */
    Page<MarketingNotificationResponse> list(int page, int limit);

    MarketingNotificationResponse get(UUID id);

    MarketingNotificationResponse schedule(UUID id, Instant scheduledDate);

    /**
     * Mails the notification to every subscriber of its category who prefers email.
     * Per-recipient failures are counted, not thrown.
     */
    NotificationSendResult send(UUID id);

    /** Returns the user's preferences, creating the defaults on first access. */
    MarketingPreferenceResponse getPreferences(User user);

    MarketingPreferenceResponse updatePreferences(User user, MarketingPreferenceRequest request);
}
