package com.basekit.authservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.io.Serial;
import java.io.Serializable;
import java.security.Principal;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * A registered identity. Besides credentials and verification flags it carries the
 * three one-time-code slots, the shared OTP request counters and the reset-link token.
 * The {@code version} column makes every save a conditional update, so two requests
 * racing on the same identity cannot both commit.
 */
@Entity
@Table(name = "users")
@NoArgsConstructor
@Setter
@Getter
@SuperBuilder
public class User extends BaseEntity implements UserDetails, Principal, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    @NotBlank(message = "First name is required")
    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @NotBlank(message = "Last name is required")
    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @NotBlank(message = "Email is required")
    @Size(max = 100, message = "Email must not exceed 100 characters")
    @Email(message = "Email should be valid")
    @Column(unique = true, nullable = false, length = 100)
    private String email;

    /** E.164, e.g. +2348012345678. */
    @NotBlank(message = "Phone is required")
    @Column(unique = true, nullable = false, length = 16)
    private String phone;

    @NotBlank(message = "Password is required")
    @Column(nullable = false)
    @JsonIgnore
    private String password;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private UserRole role = UserRole.USER;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "is_phone_verified", nullable = false)
    private boolean phoneVerified = false;

    @Builder.Default
    @Column(name = "is_email_verified", nullable = false)
    private boolean emailVerified = false;

    // ---- one-time-code slots (code and expiry are set and cleared together) ----

    @JsonIgnore
    @Column(name = "phone_verification_otp", length = 6)
    private String phoneVerificationOtp;

    @JsonIgnore
    @Column(name = "phone_verification_otp_expires")
    private Instant phoneVerificationOtpExpires;

    @JsonIgnore
    @Column(name = "email_verification_otp", length = 6)
    private String emailVerificationOtp;

    @JsonIgnore
    @Column(name = "email_verification_otp_expires")
    private Instant emailVerificationOtpExpires;

    @JsonIgnore
    @Column(name = "reset_password_otp", length = 6)
    private String resetPasswordOtp;

    @JsonIgnore
    @Column(name = "reset_password_otp_expires")
    private Instant resetPasswordOtpExpires;

    @JsonIgnore
    @Column(name = "reset_password_token", length = 64)
    private String resetPasswordToken;

    @JsonIgnore
    @Column(name = "reset_password_expires")
    private Instant resetPasswordExpires;

    // ---- request budget, shared by all slots ----

    @Column(name = "last_otp_request_time")
    private Instant lastOtpRequestTime;

    @Builder.Default
    @Column(name = "otp_request_count", nullable = false)
    private int otpRequestCount = 0;

    @Version
    @Column(name = "version")
    private Long version;

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return Set.of(new SimpleGrantedAuthority(role.authority()));
    }

    @Override
    public String getUsername() {
        // Tokens carry the id as subject, so the id is the username
        return getId() == null ? null : getId().toString();
    }

    @Override
    public boolean isEnabled() {
        return active;
    }

    @Override
    public String getName() {
        return getUsername();
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
