package com.basekit.authservice.service;

import com.basekit.authservice.entity.MarketingCategory;

public interface MailService {

    void sendResetToken(String to, String token, String firstName);

    void sendEmailVerificationOtp(String to, String code, String firstName);

    void sendMarketingEmail(String to, String title, String content, MarketingCategory category);
}
