package com.production.pdf_analysis.llm.gigachat;

import java.time.Instant;

/**
 * A bearer token and the instant after which it must not be used.
 * {@code expiresAt} already has the safety margin subtracted.
 */
public record AccessToken(String value, Instant expiresAt) {

    static final long SAFETY_MARGIN_SECONDS = 60;
    static final long DEFAULT_LIFETIME_SECONDS = 1740;
    private static final long MILLIS_THRESHOLD = 10_000_000_000L;

    public boolean isValidAt(Instant now) {
        return value != null && now.isBefore(expiresAt);
    }

    /**
     * Computes expiry from an OAuth response: {@code expires_in} seconds if present, else
     * {@code expires_at} as epoch seconds or millis, else a 30 minute lifetime.
     */
    public static AccessToken of(String value, Long expiresIn, Long expiresAt, Instant now) {
        Instant expiry;
        if (expiresIn != null && expiresIn > 0) {
            expiry = now.plusSeconds(expiresIn - SAFETY_MARGIN_SECONDS);
        } else if (expiresAt != null && expiresAt > 0) {
            long epochSeconds = expiresAt > MILLIS_THRESHOLD ? expiresAt / 1000 : expiresAt;
            expiry = Instant.ofEpochSecond(epochSeconds).minusSeconds(SAFETY_MARGIN_SECONDS);
        } else {
            expiry = now.plusSeconds(DEFAULT_LIFETIME_SECONDS);
        }
        return new AccessToken(value, expiry);
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
