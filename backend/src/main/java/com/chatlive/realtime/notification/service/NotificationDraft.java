package com.chatlive.realtime.notification.service;

import com.fasterxml.jackson.databind.JsonNode;

public record NotificationDraft(String userId, String title, String message, String type, JsonNode metadata) {
}
