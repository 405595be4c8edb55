package com.bastion.identity.api;

import com.bastion.identity.config.IdentityProperties;
import com.bastion.identity.infrastructure.web.RequireRole;
import com.bastion.security.token.TokenHeader;
import com.bastion.security.token.TokenManager;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Token lifecycle endpoints.
 *
 * <p>Refresh is public: the token in the body is the credential. Minting and key rotation
 * are operator actions restricted to the {@code admin} role.
 */
@RestController
@RequestMapping("/api/v1")
public class TokenController {

    private static final Logger log = LoggerFactory.getLogger(TokenController.class);

    public static final String ADMIN_ROLE = "admin";

    private final TokenManager tokenManager;
    private final IdentityProperties properties;

    public TokenController(TokenManager tokenManager, IdentityProperties properties) {
        this.tokenManager = tokenManager;
        this.properties = properties;
    }

    @PostMapping("/auth/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshTokenRequest request) {
        Duration ttl = ttl(request.ttlSeconds());
        String token = tokenManager.refreshToken(request.token(), ttl);
        return TokenResponse.bearer(token, ttl.toSeconds(), TokenHeader.of(token).keyId());
    }

    @PostMapping("/admin/tokens")
    @ResponseStatus(HttpStatus.CREATED)
    @RequireRole(ADMIN_ROLE)
    public TokenResponse issue(@Valid @RequestBody IssueTokenRequest request) {
        Duration ttl = ttl(request.ttlSeconds());
        String token = tokenManager.issueToken(request.subjectId(), request.displayName(), request.roles(), ttl);
        log.info("Token minted by operator: subject_id={}, ttl={}", request.subjectId(), ttl);
        return TokenResponse.bearer(token, ttl.toSeconds(), TokenHeader.of(token).keyId());
    }

    @PostMapping("/admin/signing-keys/rotate")
    @RequireRole(ADMIN_ROLE)
    public Map<String, String> rotate() {
        String keyId = tokenManager.rotateFromSource();
        return Map.of("keyId", keyId);
    }

    private Duration ttl(Long ttlSeconds) {
        return ttlSeconds == null ? properties.defaultTokenTtl() : Duration.ofSeconds(ttlSeconds);
    }
}
