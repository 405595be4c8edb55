package com.bastion.identity.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Mint request for an identity that was already resolved elsewhere.
 *
 * @param subjectId   principal ID
 * @param displayName username
 * @param roles       role names, order kept; may be omitted
 * @param ttlSeconds  token lifetime; the configured default when omitted
 */
public record IssueTokenRequest(
        @NotBlank String subjectId,
        @NotNull String displayName,
        List<String> roles,
        @Positive Long ttlSeconds) {
}
