package com.chatlive.realtime.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

// Redis is only wired by the backplane config, from the resolved service configuration.
@SpringBootApplication(
        scanBasePackages = "com.chatlive.realtime",
        exclude = {
                RedisAutoConfiguration.class,
                RedisReactiveAutoConfiguration.class,
                RedisRepositoriesAutoConfiguration.class
        }
)
@ConfigurationPropertiesScan("com.chatlive.realtime")
@EnableScheduling
public class RealtimeApplication {
    public static void main(String[] args) {
        SpringApplication.run(RealtimeApplication.class, args);
    }
}
