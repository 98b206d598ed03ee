package com.chatlive.realtime.ws;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

@Configuration
@EnableWebSocket
public class WsConfig implements WebSocketConfigurer {

    private final List<RealtimeWsHandler> handlers;
    private final WsAuthHandshakeInterceptor authInterceptor;
    private final WsProperties props;

    public WsConfig(List<RealtimeWsHandler> handlers, WsAuthHandshakeInterceptor authInterceptor, WsProperties props) {
        this.handlers = handlers;
        this.authInterceptor = authInterceptor;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        for (var handler : handlers) {
            registry.addHandler(handler, handler.namespace().path())
                    .addInterceptors(authInterceptor)
                    .setAllowedOriginPatterns(props.effectiveAllowedOrigins());
        }
    }
}
