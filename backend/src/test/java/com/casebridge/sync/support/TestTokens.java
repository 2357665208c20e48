package com.casebridge.sync.support;

import com.casebridge.sync.auth.service.jwt.JwtService;

import java.time.Duration;

public final class TestTokens {

    private TestTokens() {
    }

    public static String bearer(JwtService jwtService, String role) {
        return "Bearer " + jwtService.issueServiceToken("test-" + role, role, Duration.ofMinutes(10));
    }
}
