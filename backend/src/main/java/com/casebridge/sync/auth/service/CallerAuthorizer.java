package com.casebridge.sync.auth.service;

import com.casebridge.sync.auth.service.jwt.JwtClaims;
import com.casebridge.sync.auth.service.jwt.JwtService;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Role check for API callers. {@code admin} passes every check.
 */
@Component
public class CallerAuthorizer {

    public static final String ROLE_TRANSPORT = "transport";
    public static final String ROLE_COMMAND = "command";
    public static final String ROLE_ADMIN = "admin";

    private final JwtService jwtService;

    public CallerAuthorizer(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    public JwtClaims require(String authorization, String... roles) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        if (ROLE_ADMIN.equals(claims.role())) {
            return claims;
        }
        if (Arrays.asList(roles).contains(claims.role())) {
            return claims;
        }
        throw new IllegalArgumentException("forbidden");
    }
}
