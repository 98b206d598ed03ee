package com.chatlive.realtime.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateNotificationRequest(
        @NotBlank String user_id,
        @NotBlank @Size(max = 200) String title,
        @NotBlank @Size(max = 2000) String message,
        String type,
        JsonNode metadata
) {
}
