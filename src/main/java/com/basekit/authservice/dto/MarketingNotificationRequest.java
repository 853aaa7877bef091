package com.basekit.authservice.dto;

import com.basekit.authservice.entity.MarketingCategory;
import com.basekit.authservice.entity.NotificationTiming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record MarketingNotificationRequest(
        @NotBlank(message = "Title is required") @Size(max = 200) String title,
        @NotBlank(message = "Content is required") @Size(max = 5000) String content,
        @NotNull(message = "Category is required") MarketingCategory category,
        NotificationTiming timing,
        Instant scheduledDate
) {}
