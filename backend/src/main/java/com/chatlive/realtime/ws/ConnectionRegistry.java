package com.chatlive.realtime.ws;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections of this process, keyed by connection id. An identity may hold several
 * connections at once; channel membership is tracked per namespace.
 */
@Component
public class ConnectionRegistry {

    public record Removal(ConnectionInfo connection, boolean lastForIdentity) {
    }

    private final Map<String, ConnectionInfo> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> identityConnections = new ConcurrentHashMap<>();
    private final Map<Namespace, Map<String, Set<String>>> channelSubscribers = new EnumMap<>(Namespace.class);
    private final Map<String, Set<String>> connectionChannels = new ConcurrentHashMap<>();

    public ConnectionRegistry() {
        for (var ns : Namespace.values()) {
            channelSubscribers.put(ns, new ConcurrentHashMap<>());
        }
    }

    public void register(ConnectionInfo info) {
        connections.put(info.connectionId(), info);
        identityConnections.compute(info.identityId(), (id, set) -> {
            var next = set == null ? ConcurrentHashMap.<String>newKeySet() : set;
            next.add(info.connectionId());
            return next;
        });
    }

    public Optional<Removal> unregister(String connectionId) {
        var info = connections.remove(connectionId);
        if (info == null) return Optional.empty();

        var joined = connectionChannels.remove(connectionId);
        if (joined != null) {
            for (var key : joined) {
                dropSubscription(info.namespace(), key, connectionId);
            }
        }

        var last = new boolean[]{false};
        identityConnections.computeIfPresent(info.identityId(), (id, set) -> {
            set.remove(connectionId);
            if (set.isEmpty()) {
                last[0] = true;
                return null;
            }
            return set;
        });
        return Optional.of(new Removal(info, last[0]));
    }

    public Optional<ConnectionInfo> get(String connectionId) {
        return Optional.ofNullable(connectionId == null ? null : connections.get(connectionId));
    }

    /**
     * Most recently opened connection of the identity, across namespaces.
     */
    public Optional<ConnectionInfo> lookup(String identityId) {
        return connectionsOf(identityId).stream().max(Comparator.comparing(ConnectionInfo::connectedAt));
    }

    public List<ConnectionInfo> connectionsOf(String identityId) {
        if (identityId == null) return List.of();
        var ids = identityConnections.get(identityId);
        if (ids == null || ids.isEmpty()) return List.of();
        var out = new ArrayList<ConnectionInfo>(ids.size());
        for (var id : ids) {
            var c = connections.get(id);
            if (c != null) out.add(c);
        }
        return out;
    }

    public List<ConnectionInfo> connectionsOf(String identityId, Namespace namespace) {
        return connectionsOf(identityId).stream().filter(c -> c.namespace() == namespace).toList();
    }

    public void join(Channel channel, String connectionId) {
        var info = connections.get(connectionId);
        if (info == null) return;
        channelSubscribers.get(info.namespace())
                .computeIfAbsent(channel.key(), k -> ConcurrentHashMap.newKeySet())
                .add(connectionId);
        connectionChannels.computeIfAbsent(connectionId, k -> ConcurrentHashMap.newKeySet()).add(channel.key());
        if (!connections.containsKey(connectionId)) {
            // Unregistered concurrently; its cleanup may have run before these entries existed.
            dropSubscription(info.namespace(), channel.key(), connectionId);
            connectionChannels.remove(connectionId);
        }
    }

    public void leave(Channel channel, String connectionId) {
        var info = connections.get(connectionId);
        if (info == null) return;
        dropSubscription(info.namespace(), channel.key(), connectionId);
        var mine = connectionChannels.get(connectionId);
        if (mine != null) mine.remove(channel.key());
    }

    public List<ConnectionInfo> subscribers(Namespace namespace, Channel channel) {
        var ids = channelSubscribers.get(namespace).get(channel.key());
        if (ids == null || ids.isEmpty()) return List.of();
        var out = new ArrayList<ConnectionInfo>(ids.size());
        for (var id : ids) {
            var c = connections.get(id);
            if (c != null) out.add(c);
        }
        return out;
    }

    public Set<String> channelsOf(String connectionId) {
        var s = connectionChannels.get(connectionId);
        return s == null ? Collections.emptySet() : Collections.unmodifiableSet(s);
    }

    public Collection<ConnectionInfo> all() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public int count() {
        return connections.size();
    }

    public int count(Namespace namespace) {
        var n = 0;
        for (var c : connections.values()) {
            if (c.namespace() == namespace) n++;
        }
        return n;
    }

    /**
     * Number of channels in the namespace with at least one subscriber.
     */
    public int channelCount(Namespace namespace) {
        return channelSubscribers.get(namespace).size();
    }

    private void dropSubscription(Namespace namespace, String channelKey, String connectionId) {
        channelSubscribers.get(namespace).computeIfPresent(channelKey, (k, set) -> {
            set.remove(connectionId);
            return set.isEmpty() ? null : set;
        });
    }

    public int onlineIdentities() {
        return identityConnections.size();
    }
}
