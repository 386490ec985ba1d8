package com.production.pdf_analysis.llm.gigachat;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AccessTokenTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void expiresInWinsAndKeepsSafetyMargin() {
        AccessToken token = AccessToken.of("t", 1800L, 1L, NOW);

        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(1740));
    }

    @Test
    void expiresAtInMillisIsConverted() {
        long expiresAtMillis = NOW.plusSeconds(1800).toEpochMilli();

        AccessToken token = AccessToken.of("t", null, expiresAtMillis, NOW);

        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(1740));
    }

    @Test
    void expiresAtInSecondsIsUsedAsIs() {
        AccessToken token = AccessToken.of("t", null, NOW.plusSeconds(600).getEpochSecond(), NOW);

        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(540));
    }

    @Test
    void missingExpiryFallsBackToDefaultLifetime() {
        AccessToken token = AccessToken.of("t", null, null, NOW);

        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(AccessToken.DEFAULT_LIFETIME_SECONDS));
        assertThat(token.isValidAt(NOW)).isTrue();
        assertThat(token.isValidAt(NOW.plusSeconds(AccessToken.DEFAULT_LIFETIME_SECONDS))).isFalse();
    }

    @Test
    void toStringHidesTheValue() {
        assertThat(AccessToken.of("secret-token", 100L, null, NOW).toString()).doesNotContain("secret-token");
    }
}
