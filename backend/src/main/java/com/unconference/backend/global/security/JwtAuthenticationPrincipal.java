package com.unconference.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String displayName, List<String> roles) {

    public CallerRole callerRole() {
        return CallerRole.highestOf(roles);
    }
}
