package com.production.pdf_analysis.llm.gigachat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.ProviderAuthFailureException;
import com.production.pdf_analysis.exception.ProviderFailureException;
import com.production.pdf_analysis.exception.ProviderFailureKind;
import com.production.pdf_analysis.exception.ProviderTransientFailureException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Client-credentials token request against the GigaChat OAuth endpoint.
 */
public class GigaChatAuthClient implements TokenFetcher {

    private final AppConfig.Llm.GigaChat config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration timeout;

    public GigaChatAuthClient(AppConfig.Llm.GigaChat config, HttpClient httpClient,
                              ObjectMapper objectMapper, Clock clock, Duration timeout) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeout = timeout;
    }

    @Override
    public AccessToken fetch() {
        if (config.getAuthKey() == null || config.getAuthKey().isBlank()) {
            throw new ProviderAuthFailureException(GigaChatClient.NAME, "llm.gigachat.auth-key is not set", null);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getAuthUrl()))
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .header("RqUID", UUID.randomUUID().toString())
                .header("Authorization", "Basic " + config.getAuthKey())
                .POST(HttpRequest.BodyPublishers.ofString(
                        "scope=" + URLEncoder.encode(config.getScope(), StandardCharsets.UTF_8)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderTransientFailureException(GigaChatClient.NAME,
                    "Network error while getting access token: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFailureException(GigaChatClient.NAME, ProviderFailureKind.OTHER,
                    "Interrupted while getting access token", e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new ProviderAuthFailureException(GigaChatClient.NAME,
                    "Token request rejected: HTTP " + status, null);
        }
        if (status == 429 || status >= 500) {
            throw new ProviderTransientFailureException(GigaChatClient.NAME,
                    "Token endpoint unavailable: HTTP " + status, null);
        }
        if (status != 200) {
            throw new ProviderFailureException(GigaChatClient.NAME, ProviderFailureKind.OTHER,
                    "Failed to get access token: HTTP " + status + " - " + response.body());
        }

        try {
            JsonNode body = objectMapper.readTree(response.body());
            String token = body.path("access_token").asText(null);
            if (token == null || token.isBlank()) {
                throw new ProviderAuthFailureException(GigaChatClient.NAME, "Token response has no access_token", null);
            }
            return AccessToken.of(token, longOrNull(body.get("expires_in")), longOrNull(body.get("expires_at")),
                    clock.instant());
        } catch (IOException e) {
            throw new ProviderFailureException(GigaChatClient.NAME, ProviderFailureKind.OTHER,
                    "Unreadable token response: " + e.getMessage(), e);
        }
    }

    private static Long longOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
