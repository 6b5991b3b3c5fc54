package com.clinical.icdlookup.service.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable bearer credential as cached by {@link TokenManager}.
 *
 * @param bearerToken access token presented on registry requests
 * @param expiresAt   moment after which the token must not be used; already
 *                    shortened by the safety margin when stored
 */
public record Credential(String bearerToken, Instant expiresAt) {

    /**
     * @param now    current instant
     * @param margin minimum remaining lifetime required
     * @return whether the credential may still be handed to a caller
     */
    boolean isUsableAt(final Instant now, final Duration margin) {
        return expiresAt.minus(margin).isAfter(now);
    }

    @Override
    public String toString() {
        return "Credential[expiresAt=" + expiresAt + "]";
    }
}
