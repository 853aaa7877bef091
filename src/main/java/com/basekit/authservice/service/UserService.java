package com.basekit.authservice.service;

import com.basekit.authservice.dto.CreateUserRequest;
import com.basekit.authservice.dto.UpdateUserRequest;
import com.basekit.authservice.dto.UserSummary;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

/** Administrative management of identities. */
public interface UserService {

    Page<UserSummary> findAll(Pageable pageable);

    UserSummary findOne(UUID id);

    UserSummary create(CreateUserRequest request);

    UserSummary update(UUID id, UpdateUserRequest request);

    void remove(UUID id);
}
