package com.chatlive.realtime.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class RateLimitModules {

    public static final String CHAT = "chat";
    public static final String CHAT_ROOMS = "chat-rooms";
    public static final String CHAT_CONNECTIONS = "chat-connections";
    public static final String NOTIFICATIONS = "notifications";
    public static final String AUTH = "auth";

    private static final Logger log = LoggerFactory.getLogger(RateLimitModules.class);

    private final Map<String, ModuleConfig> modules;

    public RateLimitModules(RateLimitProperties props) {
        var merged = new LinkedHashMap<String, ModuleConfig>();
        for (var d : defaults()) {
            merged.put(d.module(), d);
        }
        var overrides = props == null || props.modules() == null ? Map.<String, RateLimitProperties.ModuleOverride>of() : props.modules();
        for (var e : overrides.entrySet()) {
            merged.put(e.getKey(), apply(e.getKey(), merged.get(e.getKey()), e.getValue()));
        }
        this.modules = Collections.unmodifiableMap(merged);
        for (var m : modules.values()) {
            log.info("rate_limit_module module={} max={} window={} block={} warnAt={} enforcement={} enabled={}",
                    m.module(), m.maxRequests(), m.window(), m.block(), m.warnThreshold(), m.enforcement(), m.enabled());
        }
    }

    public Optional<ModuleConfig> find(String module) {
        return Optional.ofNullable(module == null ? null : modules.get(module));
    }

    public Collection<ModuleConfig> all() {
        return modules.values();
    }

    static Collection<ModuleConfig> defaults() {
        return List.of(
                new ModuleConfig(CHAT, 10, Duration.ofHours(1), Duration.ofHours(1), 2, Enforcement.HARD, true),
                new ModuleConfig(CHAT_ROOMS, 10, Duration.ofHours(1), Duration.ofHours(1), 2, Enforcement.HARD, true),
                new ModuleConfig(CHAT_CONNECTIONS, 30, Duration.ofMinutes(1), Duration.ofMinutes(5), 0, Enforcement.HARD, true),
                new ModuleConfig(NOTIFICATIONS, 100, Duration.ofHours(1), Duration.ofHours(1), 10, Enforcement.SOFT, true),
                new ModuleConfig(AUTH, 5, Duration.ofMinutes(15), Duration.ofMinutes(30), 1, Enforcement.HARD, true)
        );
    }

    private static ModuleConfig apply(String name, ModuleConfig base, RateLimitProperties.ModuleOverride o) {
        if (o == null) return base;
        var window = o.window() != null ? o.window() : (base == null ? Duration.ofHours(1) : base.window());
        Duration block;
        if (o.block() != null) block = o.block();
        else if (base != null && o.window() == null) block = base.block();
        else block = window;
        return new ModuleConfig(
                name,
                o.maxRequests() != null ? o.maxRequests() : (base == null ? 100 : base.maxRequests()),
                window,
                block,
                o.warnThreshold() != null ? o.warnThreshold() : (base == null ? 0 : base.warnThreshold()),
                o.enforcement() != null ? o.enforcement() : (base == null ? Enforcement.HARD : base.enforcement()),
                o.enabled() != null ? o.enabled() : (base == null || base.enabled())
        );
    }
}
