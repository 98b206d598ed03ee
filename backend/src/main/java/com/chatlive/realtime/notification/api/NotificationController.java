package com.chatlive.realtime.notification.api;

import com.chatlive.realtime.auth.service.Identity;
import com.chatlive.realtime.auth.service.Permission;
import com.chatlive.realtime.auth.service.RequestIdentityResolver;
import com.chatlive.realtime.auth.service.Role;
import com.chatlive.realtime.common.api.ApiResponse;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.notification.service.NotificationDraft;
import com.chatlive.realtime.notification.service.NotificationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final RequestIdentityResolver identityResolver;
    private final NotificationService notificationService;

    public NotificationController(RequestIdentityResolver identityResolver, NotificationService notificationService) {
        this.identityResolver = identityResolver;
        this.notificationService = notificationService;
    }

    @PostMapping
    public ApiResponse<NotificationItem> create(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody CreateNotificationRequest req
    ) {
        var identity = identityResolver.require(authorization);
        requireMaySend(identity, req.user_id());
        return ApiResponse.ok(notificationService.sendNotificationToUser(req.user_id(), toDraft(req)));
    }

    @PostMapping("/bulk")
    public ApiResponse<List<NotificationItem>> createBulk(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody CreateBulkNotificationsRequest req
    ) {
        var identity = identityResolver.require(authorization);
        for (var n : req.notifications()) {
            requireMaySend(identity, n.user_id());
        }
        var drafts = req.notifications().stream().map(NotificationController::toDraft).toList();
        return ApiResponse.ok(notificationService.createBulkNotifications(drafts));
    }

    @GetMapping
    public ApiResponse<List<NotificationItem>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit
    ) {
        var identity = identityResolver.require(authorization);
        return ApiResponse.ok(notificationService.list(identity, limit));
    }

    @PostMapping("/{notificationId}/archive")
    public ApiResponse<NotificationItem> archive(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("notificationId") String notificationId
    ) {
        var identity = identityResolver.require(authorization);
        return ApiResponse.ok(notificationService.archive(identity, notificationId));
    }

    private static void requireMaySend(Identity identity, String targetUserId) {
        if (!identity.has(Permission.SEND_NOTIFICATION)) {
            throw RealtimeException.permissionDenied(Permission.SEND_NOTIFICATION.wire());
        }
        if (!identity.id().equals(targetUserId) && !identity.atLeast(Role.MODERATOR)) {
            throw RealtimeException.accessDenied("cannot_notify_other_user");
        }
    }

    private static NotificationDraft toDraft(CreateNotificationRequest req) {
        return new NotificationDraft(req.user_id(), req.title(), req.message(), req.type(), req.metadata());
    }
}
