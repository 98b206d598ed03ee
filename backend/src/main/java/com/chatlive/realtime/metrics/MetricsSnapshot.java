package com.chatlive.realtime.metrics;

import java.util.Map;

public record MetricsSnapshot(
        int active_connections,
        Map<String, Integer> connections_by_namespace,
        Map<String, Integer> channels_by_namespace,
        int online_users,
        long total_connections,
        long total_messages,
        long rejected_connections,
        boolean backplane_distributed,
        long uptime_seconds
) {
}
