package com.chimerapool.security;

import java.time.Instant;

/**
 * The identity carried by a validated access token.
 *
 * <p>The claims are a snapshot taken at issue time. They are trusted until {@code expiresAt}
 * without consulting storage, so a user deactivated after issue keeps a working token until it
 * expires.
 *
 * @param userId The {@code user_id} claim
 * @param username The {@code username} claim
 * @param email The {@code email} claim
 * @param issuedAt The {@code iat} claim
 * @param expiresAt The {@code exp} claim
 */
public record TokenClaims(
    long userId, String username, String email, Instant issuedAt, Instant expiresAt) {}
