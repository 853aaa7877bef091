package com.basekit.authservice.entity;

public enum NotificationTiming {
    IMMEDIATE,
    SCHEDULED
}
