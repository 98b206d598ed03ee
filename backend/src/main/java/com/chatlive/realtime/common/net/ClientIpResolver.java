package com.chatlive.realtime.common.net;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;

import java.util.Locale;

public final class ClientIpResolver {

    private ClientIpResolver() {
    }

    /**
     * Best client address for a handshake: proxy headers first, then the socket peer.
     */
    public static String resolve(ServerHttpRequest req) {
        if (req == null) return null;
        var headers = req.getHeaders();

        var ip = firstIpFromXff(firstHeader(headers, "X-Forwarded-For"));
        if (isUsableIp(ip)) return ip;

        ip = normalizeIp(firstHeader(headers, "X-Real-IP"));
        if (isUsableIp(ip)) return ip;

        // RFC 7239: Forwarded: for=1.2.3.4;proto=https
        ip = firstIpFromForwarded(firstHeader(headers, "Forwarded"));
        if (isUsableIp(ip)) return ip;

        var remote = req.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) return null;
        ip = normalizeIp(remote.getAddress().getHostAddress());
        return isUsableIp(ip) ? ip : null;
    }

    private static String firstHeader(HttpHeaders headers, String name) {
        var v = headers.getFirst(name);
        if (v == null) return null;
        var t = v.trim();
        return t.isEmpty() ? null : t;
    }

    private static String firstIpFromXff(String xff) {
        if (xff == null || xff.isBlank()) return null;
        for (var p : xff.split(",")) {
            var ip = normalizeIp(p);
            if (isUsableIp(ip)) return ip;
        }
        return null;
    }

    private static String firstIpFromForwarded(String forwarded) {
        if (forwarded == null || forwarded.isBlank()) return null;
        for (var entry : forwarded.split(",")) {
            for (var part : entry.trim().split(";")) {
                var kv = part.trim();
                if (!kv.toLowerCase(Locale.ROOT).startsWith("for=")) continue;
                var raw = kv.substring(4).trim();
                if (raw.startsWith("\"") && raw.endsWith("\"") && raw.length() >= 2) {
                    raw = raw.substring(1, raw.length() - 1);
                }
                if (raw.startsWith("[") && raw.contains("]")) {
                    raw = raw.substring(1, raw.indexOf(']'));
                }
                var ip = normalizeIp(raw);
                if (isUsableIp(ip)) return ip;
            }
        }
        return null;
    }

    private static String normalizeIp(String raw) {
        if (raw == null) return null;
        var ip = raw.trim();
        if (ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) return null;

        // IPv4 with port
        var colon = ip.indexOf(':');
        if (colon > 0 && ip.indexOf('.') >= 0) {
            var candidate = ip.substring(0, colon);
            if (candidate.chars().filter(ch -> ch == '.').count() == 3) {
                ip = candidate;
            }
        }
        return ip;
    }

    private static boolean isUsableIp(String ip) {
        return ip != null && !ip.isBlank() && !"unknown".equalsIgnoreCase(ip);
    }
}
