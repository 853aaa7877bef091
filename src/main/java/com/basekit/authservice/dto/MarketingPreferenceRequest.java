package com.basekit.authservice.dto;

/** Upsert payload; null fields keep their current (or default) value. */
public record MarketingPreferenceRequest(
        Boolean subscribedToPromotional,
        Boolean subscribedToNewsletter,
        Boolean subscribedToProductUpdates,
        Boolean subscribedToEvents,
        Boolean preferEmail,
        Boolean preferSms,
        Boolean preferPush
) {}
