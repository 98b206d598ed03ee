package com.chatlive.realtime.presence.api;

import com.chatlive.realtime.auth.service.RequestIdentityResolver;
import com.chatlive.realtime.common.api.ApiResponse;
import com.chatlive.realtime.presence.PresenceService;
import com.chatlive.realtime.presence.PresenceStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/presence")
public class PresenceController {

    private final RequestIdentityResolver identityResolver;
    private final PresenceService presenceService;

    public PresenceController(RequestIdentityResolver identityResolver, PresenceService presenceService) {
        this.identityResolver = identityResolver;
        this.presenceService = presenceService;
    }

    @GetMapping("/{userId}")
    public ApiResponse<PresenceStatus> get(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("userId") String userId
    ) {
        identityResolver.require(authorization);
        return ApiResponse.ok(presenceService.snapshot(userId));
    }
}
