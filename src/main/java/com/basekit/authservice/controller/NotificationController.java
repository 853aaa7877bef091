package com.basekit.authservice.controller;

import com.basekit.authservice.dto.*;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.service.NotificationService;
import com.basekit.authservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    // ---- admin ----

    @PostMapping
    public ResponseEntity<MarketingNotificationResponse> create(@Valid @RequestBody MarketingNotificationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(notificationService.create(request));
    }

    @GetMapping
    public ResponseEntity<Page<MarketingNotificationResponse>> list(@RequestParam(defaultValue = "1") int page,
                                                                    @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(notificationService.list(page, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MarketingNotificationResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(notificationService.get(id));
    }

    @PostMapping("/{id}/schedule")
    @ResponseMessage("Notification scheduled")
    public ResponseEntity<MarketingNotificationResponse> schedule(@PathVariable UUID id,
                                                                  @Valid @RequestBody ScheduleNotificationRequest request) {
        return ResponseEntity.ok(notificationService.schedule(id, request.scheduledDate()));
    }

    @PostMapping("/{id}/send")
    @ResponseMessage("Notification sent")
    public ResponseEntity<NotificationSendResult> send(@PathVariable UUID id) {
        return ResponseEntity.ok(notificationService.send(id));
    }

    // ---- signed-in user ----

    @GetMapping("/preferences")
    public ResponseEntity<MarketingPreferenceResponse> preferences(@AuthenticationPrincipal User principal) {
        return ResponseEntity.ok(notificationService.getPreferences(principal));
    }

    @PutMapping("/preferences")
    @ResponseMessage("Preferences updated")
    public ResponseEntity<MarketingPreferenceResponse> updatePreferences(@AuthenticationPrincipal User principal,
                                                                         @RequestBody MarketingPreferenceRequest request) {
        return ResponseEntity.ok(notificationService.updatePreferences(principal, request));
    }
}
