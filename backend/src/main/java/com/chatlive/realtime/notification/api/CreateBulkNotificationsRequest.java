package com.chatlive.realtime.notification.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateBulkNotificationsRequest(
        @NotEmpty @Size(max = 500) List<@Valid CreateNotificationRequest> notifications
) {
}
