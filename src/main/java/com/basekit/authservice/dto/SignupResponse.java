package com.basekit.authservice.dto;

import com.basekit.authservice.model.OutcomeMessage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signup always reports the created identity. {@code otpSent=false} means the
 * verification code could not be delivered and the client should ask for a resend;
 * the message then says so and becomes the envelope message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignupResponse implements OutcomeMessage {
    @JsonIgnore
    private String message;
    private boolean otpSent;
    private UserSummary user;
    private OtpStatus otp;

    @Override
    public String message() {
        return message;
    }
}
