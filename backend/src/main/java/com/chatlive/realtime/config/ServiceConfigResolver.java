package com.chatlive.realtime.config;

import com.chatlive.realtime.config.repo.ServiceConfigurationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves endpoint and credentials for an external service. Precedence: enabled row in
 * {@code service_configuration}, then {@code <SERVICE>_HOST}/{@code _PORT}/{@code _USERNAME}/{@code _PASSWORD}
 * or {@code <SERVICE>_URL} from the environment, then the built-in default.
 */
@Service
public class ServiceConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfigResolver.class);

    private static final Map<String, ServiceConfig> DEFAULTS = Map.of(
            "redis", new ServiceConfig("localhost", 6379, null, null, ServiceConfig.Source.DEFAULT)
    );

    private record Cached(ServiceConfig config, Instant expiresAt) {
    }

    private final ServiceConfigurationRepository repository;
    private final Environment environment;
    private final Clock clock;
    private final Duration cacheTtl;
    private final Map<String, Cached> cache = new ConcurrentHashMap<>();

    public ServiceConfigResolver(
            ServiceConfigurationRepository repository,
            Environment environment,
            Clock clock,
            @Value("${app.service-config.cache-ttl:60s}") Duration cacheTtl
    ) {
        this.repository = repository;
        this.environment = environment;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
    }

    public ServiceConfig resolve(String serviceName) {
        var name = serviceName == null ? "" : serviceName.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) throw new IllegalArgumentException("missing_service_name");

        var now = clock.instant();
        var hit = cache.get(name);
        if (hit != null && hit.expiresAt().isAfter(now)) {
            return hit.config();
        }

        var resolved = resolveUncached(name);
        cache.put(name, new Cached(resolved, now.plus(cacheTtl)));
        log.debug("service_config_resolved service={} source={} host={} port={}", name, resolved.source(), resolved.host(), resolved.port());
        return resolved;
    }

    public void invalidate(String serviceName) {
        if (serviceName == null) {
            cache.clear();
            return;
        }
        cache.remove(serviceName.trim().toLowerCase(Locale.ROOT));
    }

    private ServiceConfig resolveUncached(String name) {
        var fallback = DEFAULTS.getOrDefault(name, new ServiceConfig("localhost", 0, null, null, ServiceConfig.Source.DEFAULT));

        try {
            var row = repository.findEnabled(name).orElse(null);
            if (row != null && row.host() != null && !row.host().isBlank()) {
                var port = row.port() == null ? fallback.port() : row.port();
                return new ServiceConfig(row.host(), port, row.username(), row.password(), ServiceConfig.Source.ADMIN);
            }
        } catch (DataAccessException ex) {
            log.warn("service_config_admin_lookup_failed service={}", name, ex);
        }

        var fromEnv = fromEnvironment(name, fallback);
        if (fromEnv != null) return fromEnv;

        return fallback;
    }

    private ServiceConfig fromEnvironment(String name, ServiceConfig fallback) {
        var prefix = name.toUpperCase(Locale.ROOT);
        var url = env(prefix + "_URL");
        var host = env(prefix + "_HOST");
        var port = env(prefix + "_PORT");
        var username = env(prefix + "_USERNAME");
        var password = env(prefix + "_PASSWORD");

        if (host != null) {
            return new ServiceConfig(host, parsePort(port, fallback.port()), username, password, ServiceConfig.Source.ENVIRONMENT);
        }
        if (url != null) {
            try {
                var uri = URI.create(url);
                String user = username;
                String pass = password;
                var userInfo = uri.getUserInfo();
                if (userInfo != null && !userInfo.isBlank()) {
                    var idx = userInfo.indexOf(':');
                    if (idx < 0) {
                        pass = pass != null ? pass : userInfo;
                    } else {
                        user = user != null ? user : (idx == 0 ? null : userInfo.substring(0, idx));
                        pass = pass != null ? pass : userInfo.substring(idx + 1);
                    }
                }
                var p = uri.getPort() > 0 ? uri.getPort() : fallback.port();
                if (uri.getHost() != null) {
                    return new ServiceConfig(uri.getHost(), p, user, pass, ServiceConfig.Source.ENVIRONMENT);
                }
            } catch (IllegalArgumentException ex) {
                log.warn("service_config_bad_url service={}", name);
            }
        }
        return null;
    }

    private String env(String key) {
        var v = environment.getProperty(key);
        if (v == null) return null;
        var t = v.trim();
        return t.isEmpty() ? null : t;
    }

    private static int parsePort(String raw, int fallback) {
        if (raw == null) return fallback;
        try {
            var p = Integer.parseInt(raw);
            return p > 0 && p < 65536 ? p : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
