package com.casebridge.sync.auth.service.jwt;

public record JwtClaims(
        String subject,
        String role
) {
}
