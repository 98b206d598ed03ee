package com.chatlive.realtime.ws.backplane;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "app.backplane", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LocalBackplaneConfig {

    private static final Logger log = LoggerFactory.getLogger(LocalBackplaneConfig.class);

    @Bean
    public Backplane backplane() {
        log.info("backplane_local_only");
        return new LocalBackplane();
    }
}
