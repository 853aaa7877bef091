package com.basekit.authservice.dto;

import com.basekit.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/** Public projection of an identity; never carries the password hash, codes or tokens. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String role;
    private boolean active;
    private boolean phoneVerified;
    private boolean emailVerified;
    private Instant createdAt;
    private Instant modifiedAt;

    public static UserSummary from(User user) {
        return UserSummary.builder()
                .id(user.getId() == null ? null : user.getId().toString())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(user.getEmail())
                .phone(user.getPhone())
                .role(user.getRole().name())
                .active(user.isActive())
                .phoneVerified(user.isPhoneVerified())
                .emailVerified(user.isEmailVerified())
                .createdAt(user.getCreatedAt())
                .modifiedAt(user.getModifiedAt())
                .build();
    }
}
