package com.chatlive.realtime.ws;

import com.chatlive.realtime.chat.ws.ChatEventDispatcher;
import com.chatlive.realtime.metrics.RealtimeMetrics;
import com.chatlive.realtime.notification.ws.NotificationEventDispatcher;
import com.chatlive.realtime.presence.PresenceService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class WsHandlersConfig {

    @Bean
    public ThreadPoolTaskExecutor realtimeDispatchExecutor(WsProperties props) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("ws-dispatch-");
        executor.setCorePoolSize(props.effectiveDispatchThreads());
        executor.setMaxPoolSize(props.effectiveDispatchThreads());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public RealtimeWsHandler chatWsHandler(
            ChatEventDispatcher dispatcher,
            ConnectionRegistry registry,
            WsBroadcaster broadcaster,
            PresenceService presenceService,
            RealtimeMetrics metrics,
            ObjectMapper objectMapper,
            @Qualifier("realtimeDispatchExecutor") ThreadPoolTaskExecutor executor,
            Clock clock,
            WsProperties props
    ) {
        return new RealtimeWsHandler(dispatcher, registry, broadcaster, presenceService, metrics, objectMapper, executor, clock, props);
    }

    @Bean
    public RealtimeWsHandler notificationsWsHandler(
            NotificationEventDispatcher dispatcher,
            ConnectionRegistry registry,
            WsBroadcaster broadcaster,
            PresenceService presenceService,
            RealtimeMetrics metrics,
            ObjectMapper objectMapper,
            @Qualifier("realtimeDispatchExecutor") ThreadPoolTaskExecutor executor,
            Clock clock,
            WsProperties props
    ) {
        return new RealtimeWsHandler(dispatcher, registry, broadcaster, presenceService, metrics, objectMapper, executor, clock, props);
    }
}
