package com.chatlive.realtime.notification.service;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.auth.service.Identity;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.common.tx.TransactionHooks;
import com.chatlive.realtime.notification.NotificationStatus;
import com.chatlive.realtime.notification.api.NotificationItem;
import com.chatlive.realtime.notification.repo.NotificationRepository;
import com.chatlive.realtime.ratelimit.RateLimitContext;
import com.chatlive.realtime.ratelimit.RateLimitModules;
import com.chatlive.realtime.ratelimit.RateLimiter;
import com.chatlive.realtime.ws.Namespace;
import com.chatlive.realtime.ws.WsBroadcaster;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Notifications are never held back by rate limiting: going over the module budget is logged
 * and delivery continues.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository repository;
    private final UserAccountRepository userRepository;
    private final RateLimiter rateLimiter;
    private final WsBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NotificationService(
            NotificationRepository repository,
            UserAccountRepository userRepository,
            RateLimiter rateLimiter,
            WsBroadcaster broadcaster,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.repository = repository;
        this.userRepository = userRepository;
        this.rateLimiter = rateLimiter;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public NotificationItem sendNotificationToUser(String userId, NotificationDraft draft) {
        var row = prepare(userId, draft);
        return persistAndEmit(row);
    }

    /**
     * All drafts are validated before the first insert; one failure rolls back the whole batch,
     * and nothing is emitted until the batch has committed.
     */
    @Transactional
    public List<NotificationItem> createBulkNotifications(List<NotificationDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw RealtimeException.validation("empty_batch");
        }
        var rows = new ArrayList<NotificationRepository.NotificationRow>(drafts.size());
        for (var d : drafts) {
            rows.add(prepare(d == null ? null : d.userId(), d));
        }
        var items = new ArrayList<NotificationItem>(rows.size());
        for (var row : rows) {
            items.add(persistAndEmit(row));
        }
        log.info("notifications_bulk_created count={}", items.size());
        return items;
    }

    @Transactional
    public NotificationItem markAsRead(Identity identity, String notificationId, String userId) {
        var row = requireOwned(identity, notificationId, userId);
        if (NotificationStatus.fromWire(row.status()).terminal()) {
            throw RealtimeException.validation("notification_archived");
        }
        repository.markRead(notificationId, identity.id(), clock.instant());
        var updated = repository.findById(notificationId).orElseThrow(() -> RealtimeException.notFound("notification_not_found"));
        var item = toItem(updated);

        var updates = new LinkedHashMap<String, Object>();
        updates.put("status", item.status());
        updates.put("readAt", item.readAt());
        emitUpdate(identity.id(), notificationId, updates);
        return item;
    }

    @Transactional
    public int markAllAsRead(Identity identity, String userId) {
        requireSelf(identity, userId);
        var ids = repository.lockUnreadIds(identity.id());
        var count = repository.markAllRead(identity.id(), ids, clock.instant());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("userId", identity.id());
        payload.put("count", count);
        payload.put("notificationIds", ids);
        TransactionHooks.afterCommit(() -> broadcaster.sendToUser(Namespace.NOTIFICATIONS, identity.id(), "notificationsRead", payload));
        return count;
    }

    @Transactional
    public void deleteNotification(Identity identity, String notificationId, String userId) {
        requireSelf(identity, userId);
        if (notificationId == null || notificationId.isBlank()) {
            throw RealtimeException.validation("missing_notification_id");
        }
        var deleted = repository.delete(notificationId, identity.id());
        if (deleted == 0) {
            throw RealtimeException.notFound("notification_not_found");
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("notificationId", notificationId);
        payload.put("userId", identity.id());
        TransactionHooks.afterCommit(() -> broadcaster.sendToUser(Namespace.NOTIFICATIONS, identity.id(), "notificationDeleted", payload));
    }

    @Transactional
    public NotificationItem archive(Identity identity, String notificationId) {
        var row = requireOwned(identity, notificationId, null);
        if (NotificationStatus.fromWire(row.status()).terminal()) {
            return toItem(row);
        }
        repository.archive(notificationId, identity.id(), clock.instant());
        var item = toItem(repository.findById(notificationId).orElseThrow(() -> RealtimeException.notFound("notification_not_found")));
        emitUpdate(identity.id(), notificationId, Map.of("status", item.status()));
        return item;
    }

    public List<NotificationItem> list(Identity identity, int limit) {
        var n = Math.max(1, Math.min(limit, 200));
        return repository.listForUser(identity.id(), n).stream().map(this::toItem).toList();
    }

    private NotificationRepository.NotificationRow prepare(String userId, NotificationDraft draft) {
        if (draft == null || userId == null || userId.isBlank()) {
            throw RealtimeException.validation("missing_user_id");
        }
        if (draft.title() == null || draft.title().isBlank() || draft.message() == null || draft.message().isBlank()) {
            throw RealtimeException.validation("missing_title_or_message");
        }
        if (!userRepository.exists(userId)) {
            throw RealtimeException.notFound("user_not_found");
        }
        var now = clock.instant();
        var type = draft.type() == null || draft.type().isBlank() ? "info" : draft.type().trim();
        var metadata = draft.metadata() == null || draft.metadata().isNull() ? null : draft.metadata().toString();
        return new NotificationRepository.NotificationRow(
                "ntf_" + UUID.randomUUID(),
                userId,
                draft.title().trim(),
                draft.message().trim(),
                type,
                NotificationStatus.UNREAD.wire(),
                metadata,
                now,
                now,
                null
        );
    }

    private NotificationItem persistAndEmit(NotificationRepository.NotificationRow row) {
        var limit = rateLimiter.checkLimit(row.userId(), RateLimitModules.NOTIFICATIONS,
                RateLimitContext.forUser(row.userId(), "send_notification"));
        if (limit.exceeded()) {
            log.warn("notification_rate_limit_exceeded userId={} notificationId={}", row.userId(), row.id());
        }

        repository.insert(row);
        var item = toItem(row);
        TransactionHooks.afterCommit(() -> broadcaster.sendToUser(Namespace.NOTIFICATIONS, row.userId(), "newNotification", item));
        return item;
    }

    private void emitUpdate(String userId, String notificationId, Map<String, Object> updates) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("notificationId", notificationId);
        payload.put("updates", updates);
        payload.put("userId", userId);
        TransactionHooks.afterCommit(() -> broadcaster.sendToUser(Namespace.NOTIFICATIONS, userId, "notificationUpdate", payload));
    }

    private NotificationRepository.NotificationRow requireOwned(Identity identity, String notificationId, String userId) {
        requireSelf(identity, userId);
        if (notificationId == null || notificationId.isBlank()) {
            throw RealtimeException.validation("missing_notification_id");
        }
        var row = repository.findById(notificationId).orElseThrow(() -> RealtimeException.notFound("notification_not_found"));
        if (!identity.id().equals(row.userId())) {
            throw RealtimeException.accessDenied("not_notification_owner");
        }
        return row;
    }

    private static void requireSelf(Identity identity, String userId) {
        if (userId != null && !userId.isBlank() && !userId.equals(identity.id())) {
            throw RealtimeException.accessDenied("identity_mismatch");
        }
    }

    private NotificationItem toItem(NotificationRepository.NotificationRow row) {
        JsonNode metadata = null;
        if (row.metadataJson() != null && !row.metadataJson().isBlank()) {
            try {
                metadata = objectMapper.readTree(row.metadataJson());
            } catch (Exception ex) {
                log.warn("notification_metadata_unreadable notificationId={}", row.id(), ex);
            }
        }
        return new NotificationItem(row.id(), row.userId(), row.title(), row.message(), row.type(), row.status(), metadata,
                row.createdAt(), row.updatedAt(), row.readAt());
    }
}
