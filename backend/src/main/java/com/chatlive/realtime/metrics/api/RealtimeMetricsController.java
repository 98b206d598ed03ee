package com.chatlive.realtime.metrics.api;

import com.chatlive.realtime.auth.service.Permission;
import com.chatlive.realtime.auth.service.RequestIdentityResolver;
import com.chatlive.realtime.common.api.ApiResponse;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.metrics.MetricsSnapshot;
import com.chatlive.realtime.metrics.RealtimeMetrics;
import com.chatlive.realtime.ws.backplane.Backplane;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/realtime")
public class RealtimeMetricsController {

    private final RequestIdentityResolver identityResolver;
    private final RealtimeMetrics metrics;
    private final Backplane backplane;

    public RealtimeMetricsController(RequestIdentityResolver identityResolver, RealtimeMetrics metrics, Backplane backplane) {
        this.identityResolver = identityResolver;
        this.metrics = metrics;
        this.backplane = backplane;
    }

    @GetMapping("/metrics")
    public ApiResponse<MetricsSnapshot> metrics(@RequestHeader(value = "Authorization", required = false) String authorization) {
        var identity = identityResolver.require(authorization);
        if (!identity.has(Permission.VIEW_ADMIN_PANEL)) {
            throw RealtimeException.permissionDenied(Permission.VIEW_ADMIN_PANEL.wire());
        }
        return ApiResponse.ok(metrics.snapshot(backplane.distributed()));
    }
}
