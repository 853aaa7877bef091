package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.dto.MarketingNotificationRequest;
import com.basekit.authservice.dto.MarketingNotificationResponse;
import com.basekit.authservice.dto.MarketingPreferenceRequest;
import com.basekit.authservice.dto.MarketingPreferenceResponse;
import com.basekit.authservice.dto.NotificationSendResult;
import com.basekit.authservice.entity.MarketingNotification;
import com.basekit.authservice.entity.NotificationTiming;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.entity.UserMarketingPreference;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.exception.ResourceExceptions;
import com.basekit.authservice.repository.MarketingNotificationRepository;
import com.basekit.authservice.repository.UserMarketingPreferenceRepository;
import com.basekit.authservice.service.MailService;
import com.basekit.authservice.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    private static final int MAX_PAGE_SIZE = 100;

    private final MarketingNotificationRepository notificationRepository;
    private final UserMarketingPreferenceRepository preferenceRepository;
    private final MailService mailService;
    private final Clock clock;

    @Override
    @Transactional
    public MarketingNotificationResponse create(MarketingNotificationRequest request) {
        NotificationTiming timing = request.timing() == null ? NotificationTiming.IMMEDIATE : request.timing();
        if (timing == NotificationTiming.SCHEDULED && request.scheduledDate() == null) {
            throw new RequestExceptions.BadRequest("Scheduled notifications need a scheduledDate");
        }
        MarketingNotification notification = MarketingNotification.builder()
                .title(request.title())
                .content(request.content())
                .category(request.category())
                .timing(timing)
                .scheduledDate(request.scheduledDate())
                .build();
        MarketingNotification saved = notificationRepository.save(notification);
        log.info("Marketing notification created id={} category={} timing={}", saved.getId(), saved.getCategory(), timing);
        return MarketingNotificationResponse.from(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<MarketingNotificationResponse> list(int page, int limit) {
        int safePage = Math.max(1, page) - 1;
        int safeLimit = Math.min(Math.max(1, limit), MAX_PAGE_SIZE);
        return notificationRepository
                .findAll(PageRequest.of(safePage, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt")))
                .map(MarketingNotificationResponse::from);
    }

    @Override
    @Transactional(readOnly = true)
    public MarketingNotificationResponse get(UUID id) {
        return MarketingNotificationResponse.from(load(id));
    }

    @Override
    @Transactional
    public MarketingNotificationResponse schedule(UUID id, Instant scheduledDate) {
        MarketingNotification notification = load(id);
        if (notification.isSent()) {
            throw new RequestExceptions.BadRequest("Notification has already been sent");
        }
        notification.setTiming(NotificationTiming.SCHEDULED);
        notification.setScheduledDate(scheduledDate);
        log.info("Marketing notification scheduled id={} at={}", id, scheduledDate);
        return MarketingNotificationResponse.from(notificationRepository.save(notification));
    }

    @Override
    @Transactional
    public NotificationSendResult send(UUID id) {
        MarketingNotification notification = load(id);
        if (notification.isSent()) {
            throw new RequestExceptions.BadRequest("Notification has already been sent");
        }
        final Instant now = clock.instant();
        if (notification.getTiming() == NotificationTiming.SCHEDULED
                && notification.getScheduledDate() != null
                && now.isBefore(notification.getScheduledDate())) {
            throw new RequestExceptions.BadRequest("Scheduled notification time has not arrived yet");
        }

        List<UserMarketingPreference> recipients = preferenceRepository.findEmailSubscribers(notification.getCategory());
        int success = 0;
        int failure = 0;
        for (UserMarketingPreference recipient : recipients) {
            if (!StringUtils.hasText(recipient.getEmail())) {
                failure++;
                continue;
            }
            try {
                mailService.sendMarketingEmail(recipient.getEmail(), notification.getTitle(),
                        notification.getContent(), notification.getCategory());
                success++;
            } catch (RuntimeException e) {
                failure++;
                log.warn("Marketing mail failed notificationId={} userId={}: {}", id, recipient.getUserId(), e.getMessage());
            }
        }

        notification.setSent(true);
        notification.setSentAt(now);
        notification.setSuccessCount(success);
        notification.setFailureCount(failure);
        notificationRepository.save(notification);

        log.info("Marketing notification sent id={} recipients={} success={} failure={}",
                id, recipients.size(), success, failure);
        return new NotificationSendResult("Notification sent", recipients.size(), success, failure);
    }

    @Override
    @Transactional
    public MarketingPreferenceResponse getPreferences(User user) {
        return MarketingPreferenceResponse.from(loadOrCreatePreference(user));
    }

    @Override
    @Transactional
    public MarketingPreferenceResponse updatePreferences(User user, MarketingPreferenceRequest request) {
        UserMarketingPreference pref = loadOrCreatePreference(user);
        pref.setEmail(user.getEmail());
        if (request.subscribedToPromotional() != null) pref.setSubscribedToPromotional(request.subscribedToPromotional());
        if (request.subscribedToNewsletter() != null) pref.setSubscribedToNewsletter(request.subscribedToNewsletter());
        if (request.subscribedToProductUpdates() != null) pref.setSubscribedToProductUpdates(request.subscribedToProductUpdates());
        if (request.subscribedToEvents() != null) pref.setSubscribedToEvents(request.subscribedToEvents());
        if (request.preferEmail() != null) pref.setPreferEmail(request.preferEmail());
        if (request.preferSms() != null) pref.setPreferSms(request.preferSms());
        if (request.preferPush() != null) pref.setPreferPush(request.preferPush());

        UserMarketingPreference saved = preferenceRepository.save(pref);
        log.info("Marketing preferences updated userId={}", user.getId());
        return MarketingPreferenceResponse.from(saved);
    }

    // -------------------- helpers --------------------

    private MarketingNotification load(UUID id) {
        return notificationRepository.findById(id)
                .orElseThrow(() -> new ResourceExceptions.NotFound("Marketing notification not found"));
    }

    private UserMarketingPreference loadOrCreatePreference(User user) {
        return preferenceRepository.findByUserId(user.getId())
                .orElseGet(() -> preferenceRepository.save(UserMarketingPreference.builder()
                        .userId(user.getId())
                        .email(user.getEmail())
                        .build()));
    }
}
