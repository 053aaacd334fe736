package com.dbmaster.notification;

import com.dbmaster.model.Notification;
import com.dbmaster.model.NotificationChannel;
import com.dbmaster.model.NotificationPreferences;
import com.dbmaster.model.NotificationRequest;
import com.dbmaster.model.NotificationResult;
import com.dbmaster.model.NotificationResult.ChannelOutcome;
import com.dbmaster.repository.NotificationPreferencesRepository;
import com.dbmaster.repository.NotificationRepository;
import com.dbmaster.service.AccessDeniedException;
import com.dbmaster.service.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fans a notification out to its channels according to the owner's preferences and keeps an in-app
 * record of what was delivered.
 */
@Slf4j
@Service
public class NotificationService {
    static final String NO_SENDER = "no sender configured";

    private final Map<NotificationChannel, NotificationSender> senders = new EnumMap<>(NotificationChannel.class);
    private final NotificationRepository notificationRepository;
    private final NotificationPreferencesRepository preferencesRepository;
    private final Clock clock;

    public NotificationService(
            List<NotificationSender> senders,
            NotificationRepository notificationRepository,
            NotificationPreferencesRepository preferencesRepository,
            Clock clock
    ) {
        for (NotificationSender sender : senders) {
            NotificationSender previous = this.senders.put(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Duplicate notification sender for channel " + sender.channel());
            }
        }
        this.notificationRepository = notificationRepository;
        this.preferencesRepository = preferencesRepository;
        this.clock = clock;
    }

    /**
     * Delivers the request on every requested channel (EMAIL when none is set). A channel failure
     * is recorded in the result and never aborts the other channels.
     */
    public NotificationResult send(NotificationRequest request, String ownerId) {
        NotificationPreferences prefs = getPreferences(ownerId);
        if (!prefs.allows(request.getType())) {
            log.info("Notification suppressed by preferences: owner_id={}, type={}", ownerId, request.getType());
            return NotificationResult.suppressedResult();
        }

        Instant now = clock.instant();
        Map<String, Object> data = request.getData() != null ? request.getData() : Map.of();
        Notification stored = notificationRepository.save(Notification.builder()
                .ownerId(ownerId)
                .type(request.getType())
                .title(request.getTitle())
                .message(request.getMessage())
                .priority(request.getPriority())
                .read(false)
                .sentVia(new LinkedHashSet<>())
                .scheduledQueryId(asString(data.get("scheduledQueryId")))
                .executionId(asString(data.get("executionId")))
                .data(new LinkedHashMap<>(data))
                .createdAt(now)
                .updatedAt(now)
                .build());

        Set<NotificationChannel> channels = request.getChannels() == null || request.getChannels().isEmpty()
                ? Set.of(NotificationChannel.EMAIL)
                : request.getChannels();

        Map<NotificationChannel, ChannelOutcome> outcomes = new EnumMap<>(NotificationChannel.class);
        Set<NotificationChannel> sentVia = new LinkedHashSet<>();
        for (NotificationChannel channel : channels) {
            ChannelOutcome outcome = deliver(channel, request, prefs, ownerId);
            outcomes.put(channel, outcome);
            if (outcome.success()) {
                sentVia.add(channel);
            } else {
                log.warn("Notification channel failed: owner_id={}, notification_id={}, channel={}, error={}",
                        ownerId, stored.getId(), channel, outcome.error());
            }
        }

        if (!sentVia.isEmpty()) {
            notificationRepository.save(stored.toBuilder().sentVia(sentVia).updatedAt(clock.instant()).build());
        }
        return new NotificationResult(stored.getId(), false, outcomes);
    }

    private ChannelOutcome deliver(NotificationChannel channel, NotificationRequest request, NotificationPreferences prefs, String ownerId) {
        DeliveryTarget target;
        switch (channel) {
            case EMAIL: {
                NotificationPreferences.Email email = prefs.getEmail();
                if (email == null || !email.isEnabled()) {
                    return ChannelOutcome.failed("email notifications disabled");
                }
                List<String> to = new ArrayList<>();
                if (email.getAddress() != null && !email.getAddress().isBlank()) {
                    to.add(email.getAddress());
                }
                if (request.getRecipients() != null) {
                    to.addAll(request.getRecipients());
                }
                if (to.isEmpty()) {
                    return ChannelOutcome.failed("no email recipients");
                }
                target = new DeliveryTarget(ownerId, to, List.of());
                break;
            }
            case PUSH: {
                NotificationPreferences.Push push = prefs.getPush();
                if (push == null || !push.isEnabled()) {
                    return ChannelOutcome.failed("push notifications disabled");
                }
                if (push.getDeviceTokens() == null || push.getDeviceTokens().isEmpty()) {
                    return ChannelOutcome.failed("no device tokens registered");
                }
                target = new DeliveryTarget(ownerId, List.of(), push.getDeviceTokens());
                break;
            }
            case WEBHOOK:
                if (request.getWebhookConfig() == null || request.getWebhookConfig().getUrl() == null
                        || request.getWebhookConfig().getUrl().isBlank()) {
                    return ChannelOutcome.failed("webhook configuration missing");
                }
                target = new DeliveryTarget(ownerId, List.of(), List.of());
                break;
            default:
                return ChannelOutcome.failed("unsupported channel " + channel);
        }

        NotificationSender sender = senders.get(channel);
        if (sender == null) {
            return ChannelOutcome.failed(NO_SENDER);
        }
        try {
            sender.send(request, target);
            return ChannelOutcome.delivered();
        } catch (NotificationDeliveryException e) {
            return ChannelOutcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Notification sender crashed: channel={}, owner_id={}", channel, ownerId, e);
            return ChannelOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public List<Notification> listForOwner(String ownerId, int limit) {
        return notificationRepository.findByOwner(ownerId, limit > 0 ? limit : 50);
    }

    public Notification markRead(String ownerId, String notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new NotFoundException("Notification not found: " + notificationId));
        if (!ownerId.equals(notification.getOwnerId())) {
            throw new AccessDeniedException("Notification belongs to another user");
        }
        if (notification.isRead()) {
            return notification;
        }
        return notificationRepository.save(notification.toBuilder().read(true).updatedAt(clock.instant()).build());
    }

    public NotificationPreferences getPreferences(String ownerId) {
        return preferencesRepository.findByOwner(ownerId).orElseGet(() -> NotificationPreferences.defaults(ownerId));
    }

    public NotificationPreferences updatePreferences(String ownerId, NotificationPreferences preferences) {
        NotificationPreferences toSave = preferences.toBuilder().ownerId(ownerId).build();
        if (toSave.getEmail() == null) {
            toSave.setEmail(new NotificationPreferences.Email(true, null));
        }
        if (toSave.getPush() == null) {
            toSave.setPush(new NotificationPreferences.Push(true, new ArrayList<>()));
        }
        return preferencesRepository.save(toSave);
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
