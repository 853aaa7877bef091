package com.basekit.authservice.repository;

import com.basekit.authservice.entity.MarketingNotification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface MarketingNotificationRepository extends JpaRepository<MarketingNotification, UUID> {
}
