package com.chatlive.realtime.ws;

import com.chatlive.realtime.auth.service.AuthException;
import com.chatlive.realtime.auth.service.HandshakeCredentials;
import com.chatlive.realtime.auth.service.TokenValidator;
import com.chatlive.realtime.common.net.ClientIpResolver;
import com.chatlive.realtime.metrics.RealtimeMetrics;
import com.chatlive.realtime.ratelimit.RateLimitContext;
import com.chatlive.realtime.ratelimit.RateLimitModules;
import com.chatlive.realtime.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.util.Map;

/**
 * Authenticates the upgrade request. A rejected handshake never reaches the handler, so nothing
 * gets registered for it.
 */
@Component
public class WsAuthHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_IDENTITY = "realtime.identity";
    public static final String ATTR_CLIENT_IP = "realtime.clientIp";

    private static final Logger log = LoggerFactory.getLogger(WsAuthHandshakeInterceptor.class);

    private final TokenValidator tokenValidator;
    private final RateLimiter rateLimiter;
    private final RealtimeMetrics metrics;
    private final Clock clock;

    public WsAuthHandshakeInterceptor(TokenValidator tokenValidator, RateLimiter rateLimiter, RealtimeMetrics metrics, Clock clock) {
        this.tokenValidator = tokenValidator;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        var ip = ClientIpResolver.resolve(request);
        var path = request.getURI().getPath();

        var query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        if (query.containsKey("token")) {
            log.warn("ws_query_token_ignored path={} ip={}", path, ip);
        }

        if (path != null && path.endsWith(Namespace.CHAT.path())) {
            var subject = ip == null ? "unknown" : ip;
            var limit = rateLimiter.checkLimit(subject, RateLimitModules.CHAT_CONNECTIONS, RateLimitContext.forIp(ip, "ws_connect"));
            if (!limit.allowed()) {
                response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
                response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(limit.retryAfterSeconds(clock.instant())));
                metrics.connectionRejected("rate_limited");
                log.info("ws_handshake_rejected reason=rate_limited path={} ip={}", path, ip);
                return false;
            }
        }

        var credential = HandshakeCredentials.extract(request.getHeaders()).orElse(null);
        try {
            var identity = tokenValidator.validate(credential);
            attributes.put(ATTR_IDENTITY, identity);
            if (ip != null) attributes.put(ATTR_CLIENT_IP, ip);
            return true;
        } catch (AuthException ex) {
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            metrics.connectionRejected(ex.code().wire());
            log.info("ws_handshake_rejected reason={} path={} ip={}", ex.code().wire(), path, ip);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.debug("ws_handshake_failed path={}", request.getURI().getPath(), exception);
        }
    }
}
