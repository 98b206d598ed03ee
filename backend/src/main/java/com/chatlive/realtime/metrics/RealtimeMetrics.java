package com.chatlive.realtime.metrics;

import com.chatlive.realtime.ws.ConnectionRegistry;
import com.chatlive.realtime.ws.Namespace;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Micrometer meters for the WebSocket layer. Active-connection gauges read the registry directly,
 * so they are current on every connect and disconnect.
 */
@Component
public class RealtimeMetrics {

    private final MeterRegistry registry;
    private final ConnectionRegistry connections;
    private final Clock clock;
    private final Instant startedAt;

    private final Map<Namespace, Counter> connectionsTotal = new EnumMap<>(Namespace.class);
    private final Map<Namespace, Counter> messagesTotal = new EnumMap<>(Namespace.class);
    private final Counter rejected;

    public RealtimeMetrics(MeterRegistry registry, ConnectionRegistry connections, Clock clock) {
        this.registry = registry;
        this.connections = connections;
        this.clock = clock;
        this.startedAt = clock.instant();

        for (var ns : Namespace.values()) {
            Gauge.builder("realtime.connections.active", connections, r -> r.count(ns))
                    .tag("namespace", ns.wire())
                    .description("Open WebSocket connections on this process")
                    .register(registry);
            connectionsTotal.put(ns, Counter.builder("realtime.connections.total")
                    .tag("namespace", ns.wire())
                    .register(registry));
            messagesTotal.put(ns, Counter.builder("realtime.messages.total")
                    .tag("namespace", ns.wire())
                    .register(registry));
        }
        Gauge.builder("realtime.users.online", connections, ConnectionRegistry::onlineIdentities)
                .register(registry);
        this.rejected = Counter.builder("realtime.connections.rejected").register(registry);
    }

    public void connectionOpened(Namespace ns) {
        connectionsTotal.get(ns).increment();
    }

    public void messageHandled(Namespace ns) {
        messagesTotal.get(ns).increment();
    }

    public void connectionRejected(String reason) {
        rejected.increment();
        registry.counter("realtime.connections.rejected.by_reason", "reason", reason == null ? "unknown" : reason).increment();
    }

    public MetricsSnapshot snapshot(boolean backplaneDistributed) {
        var byNamespace = new LinkedHashMap<String, Integer>();
        var channelsByNamespace = new LinkedHashMap<String, Integer>();
        long totalConnections = 0;
        long totalMessages = 0;
        for (var ns : Namespace.values()) {
            byNamespace.put(ns.wire(), connections.count(ns));
            channelsByNamespace.put(ns.wire(), connections.channelCount(ns));
            totalConnections += (long) connectionsTotal.get(ns).count();
            totalMessages += (long) messagesTotal.get(ns).count();
        }
        return new MetricsSnapshot(
                connections.count(),
                byNamespace,
                channelsByNamespace,
                connections.onlineIdentities(),
                totalConnections,
                totalMessages,
                (long) rejected.count(),
                backplaneDistributed,
                Duration.between(startedAt, clock.instant()).toSeconds()
        );
    }
}
