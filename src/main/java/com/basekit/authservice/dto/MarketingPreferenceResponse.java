package com.basekit.authservice.dto;

import com.basekit.authservice.entity.UserMarketingPreference;

import java.util.UUID;

public record MarketingPreferenceResponse(
        UUID userId,
        String email,
        boolean subscribedToPromotional,
        boolean subscribedToNewsletter,
        boolean subscribedToProductUpdates,
        boolean subscribedToEvents,
        boolean preferEmail,
        boolean preferSms,
        boolean preferPush
) {
    public static MarketingPreferenceResponse from(UserMarketingPreference p) {
        return new MarketingPreferenceResponse(
                p.getUserId(),
                p.getEmail(),
                p.isSubscribedToPromotional(),
                p.isSubscribedToNewsletter(),
                p.isSubscribedToProductUpdates(),
                p.isSubscribedToEvents(),
                p.isPreferEmail(),
                p.isPreferSms(),
                p.isPreferPush()
        );
    }
}
