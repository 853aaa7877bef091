package com.basekit.authservice.entity;

public enum MarketingCategory {
    PROMOTIONAL,
    NEWSLETTER,
    PRODUCT_UPDATES,
    EVENTS
}
