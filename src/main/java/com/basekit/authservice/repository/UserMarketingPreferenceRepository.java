package com.basekit.authservice.repository;

import com.basekit.authservice.entity.MarketingCategory;
import com.basekit.authservice.entity.UserMarketingPreference;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserMarketingPreferenceRepository extends JpaRepository<UserMarketingPreference, UUID> {

    Optional<UserMarketingPreference> findByUserId(UUID userId);

    void deleteByUserId(UUID userId);

    List<UserMarketingPreference> findAllBySubscribedToPromotionalTrueAndPreferEmailTrue();

    List<UserMarketingPreference> findAllBySubscribedToNewsletterTrueAndPreferEmailTrue();

    List<UserMarketingPreference> findAllBySubscribedToProductUpdatesTrueAndPreferEmailTrue();

    List<UserMarketingPreference> findAllBySubscribedToEventsTrueAndPreferEmailTrue();

    /** Email recipients who opted in to {@code category}. */
    default List<UserMarketingPreference> findEmailSubscribers(MarketingCategory category) {
        return switch (category) {
            case PROMOTIONAL -> findAllBySubscribedToPromotionalTrueAndPreferEmailTrue();
            case NEWSLETTER -> findAllBySubscribedToNewsletterTrueAndPreferEmailTrue();
            case PRODUCT_UPDATES -> findAllBySubscribedToProductUpdatesTrueAndPreferEmailTrue();
            case EVENTS -> findAllBySubscribedToEventsTrueAndPreferEmailTrue();
        };
    }
}
