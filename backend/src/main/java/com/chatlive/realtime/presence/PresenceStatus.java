package com.chatlive.realtime.presence;

import java.time.Instant;

public record PresenceStatus(String user_id, boolean online, Instant last_seen) {
}
