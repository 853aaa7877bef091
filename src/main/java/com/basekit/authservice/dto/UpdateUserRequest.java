package com.basekit.authservice.dto;

import com.basekit.authservice.entity.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial update: null fields are left untouched. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserRequest {

    @Size(max = 100)
    private String firstName;

    @Size(max = 100)
    private String lastName;

    @Email(message = "Email is not valid")
    @Size(max = 100)
    private String email;

    private String phone;

    @Size(min = 8, max = 72, message = "Password must be between 8 and 72 characters")
    private String password;

    private UserRole role;

    private Boolean active;

    private Boolean phoneVerified;

    private Boolean emailVerified;
}
