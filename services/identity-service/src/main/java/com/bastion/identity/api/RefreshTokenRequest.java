package com.bastion.identity.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * @param token      the still-valid token to replace
 * @param ttlSeconds lifetime of the new token; the configured default when omitted
 */
public record RefreshTokenRequest(@NotBlank String token, @Positive Long ttlSeconds) {
}
