package com.basekit.authservice.controller;

import com.basekit.authservice.dto.CreateUserRequest;
import com.basekit.authservice.dto.MessageResponse;
import com.basekit.authservice.dto.UpdateUserRequest;
import com.basekit.authservice.dto.UserSummary;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.service.AuthService;
import com.basekit.authservice.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/** {@code /users/me} for any signed-in user; everything else is ADMIN only (see SecurityConfig). */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final AuthService authService;

    @GetMapping("/me")
    public ResponseEntity<UserSummary> me(@AuthenticationPrincipal User principal) {
        return ResponseEntity.ok(authService.currentUser(principal.getId()));
    }

    @GetMapping
    public ResponseEntity<Page<UserSummary>> list(
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(userService.findAll(pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserSummary> get(@PathVariable UUID id) {
        return ResponseEntity.ok(userService.findOne(id));
    }

    @PostMapping
    public ResponseEntity<UserSummary> create(@Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(request));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<UserSummary> update(@PathVariable UUID id, @Valid @RequestBody UpdateUserRequest request) {
        return ResponseEntity.ok(userService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable UUID id) {
        userService.remove(id);
        return ResponseEntity.ok(new MessageResponse("User deleted successfully"));
    }
}
