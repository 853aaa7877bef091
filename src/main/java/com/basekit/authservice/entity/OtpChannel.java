package com.basekit.authservice.entity;

public enum OtpChannel {
    SMS,
    EMAIL
}
