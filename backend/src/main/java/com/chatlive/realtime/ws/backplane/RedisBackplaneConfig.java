package com.chatlive.realtime.ws.backplane;

import com.chatlive.realtime.config.ServiceConfigResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

@Configuration
@ConditionalOnProperty(prefix = "app.backplane", name = "enabled", havingValue = "true")
public class RedisBackplaneConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisBackplaneConfig.class);

    /**
     * Falls back to {@link LocalBackplane} when Redis cannot be reached at startup.
     */
    @Bean
    public Backplane backplane(BackplaneProperties props, ServiceConfigResolver resolver, ObjectMapper objectMapper) {
        LettuceConnectionFactory factory = null;
        try {
            var cfg = resolver.resolve("redis");
            var standalone = new RedisStandaloneConfiguration(cfg.host(), cfg.port());
            if (cfg.username() != null) standalone.setUsername(cfg.username());
            if (cfg.password() != null) standalone.setPassword(cfg.password());

            var client = LettuceClientConfiguration.builder()
                    .commandTimeout(props.effectiveConnectTimeout())
                    .build();
            factory = new LettuceConnectionFactory(standalone, client);
            factory.afterPropertiesSet();
            factory.start();
            try (var conn = factory.getConnection()) {
                conn.ping();
            }

            var backplane = new RedisBackplane(factory, objectMapper, props.effectiveChannel());
            log.info("backplane_connected host={} port={} source={} node={}", cfg.host(), cfg.port(), cfg.source(), backplane.nodeId());
            return backplane;
        } catch (RuntimeException ex) {
            log.warn("backplane_unavailable_fallback_local", ex);
            if (factory != null) {
                factory.destroy();
            }
            return new LocalBackplane();
        }
    }
}
