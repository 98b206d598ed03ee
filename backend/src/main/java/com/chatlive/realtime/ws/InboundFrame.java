package com.chatlive.realtime.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code {"event": "...", "data": ..., "ackId": "..."}} as received from a client.
 */
public record InboundFrame(String event, JsonNode data, String ackId) {
}
