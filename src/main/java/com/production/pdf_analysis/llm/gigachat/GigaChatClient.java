package com.production.pdf_analysis.llm.gigachat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.ProviderAuthFailureException;
import com.production.pdf_analysis.exception.ProviderFailureException;
import com.production.pdf_analysis.exception.ProviderFailureKind;
import com.production.pdf_analysis.exception.ProviderTransientFailureException;
import com.production.pdf_analysis.llm.LlmProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * GigaChat chat-completions client. Authenticates with a bearer token from its
 * {@link GigaChatTokenManager}; a 401 drops the token and the call is repeated once
 * with a fresh one.
 */
@Slf4j
public class GigaChatClient implements LlmProvider {

    public static final String NAME = "gigachat";

    private final AppConfig.Llm.GigaChat config;
    private final HttpClient httpClient;
    private final GigaChatTokenManager tokenManager;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public GigaChatClient(AppConfig.Llm.GigaChat config, HttpClient httpClient,
                          GigaChatTokenManager tokenManager, ObjectMapper objectMapper, Duration timeout) {
        this.config = config;
        this.httpClient = httpClient;
        this.tokenManager = tokenManager;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(String prompt, String systemPrompt) {
        String body = requestBody(prompt, systemPrompt);

        HttpResponse<String> response = send(tokenManager.getToken(), body);
        if (response.statusCode() == 401) {
            log.info("GigaChat access token rejected, refreshing");
            tokenManager.invalidate();
            response = send(tokenManager.getToken(), body);
            if (response.statusCode() == 401) {
                throw new ProviderAuthFailureException(NAME, "Chat request rejected after token refresh", null);
            }
        }

        int status = response.statusCode();
        if (status == 403) {
            throw new ProviderAuthFailureException(NAME, "HTTP 403 - " + response.body(), null);
        }
        if (status == 429 || status == 502 || status == 503 || status == 504) {
            throw new ProviderTransientFailureException(NAME, "HTTP " + status + " - temporarily unavailable", null);
        }
        if (status != 200) {
            throw new ProviderFailureException(NAME, ProviderFailureKind.OTHER,
                    "GigaChat API error: " + status + " - " + response.body());
        }

        String content = extractContent(response.body());
        if (content == null || content.isBlank()) {
            log.error("Unexpected GigaChat response format: {}", response.body());
            throw new ProviderFailureException(NAME, ProviderFailureKind.EMPTY_RESPONSE,
                    "Empty or unexpected content in GigaChat response");
        }
        return content;
    }

    String requestBody(String prompt, String systemPrompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        ArrayNode messages = root.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        messages.addObject().put("role", "user").put("content", prompt);
        root.put("temperature", config.getTemperature());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (IOException e) {
            throw new ProviderFailureException(NAME, ProviderFailureKind.OTHER, "Cannot encode request", e);
        }
    }

    private HttpResponse<String> send(String token, String body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getApiBase() + "/chat/completions"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderTransientFailureException(NAME, "Request timed out", e);
        } catch (IOException e) {
            throw new ProviderTransientFailureException(NAME, "Connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFailureException(NAME, ProviderFailureKind.OTHER, "Interrupted", e);
        }
    }

    /**
     * Reads {@code choices[0].message.content}, falling back to top-level
     * {@code content}, {@code text} or {@code message}.
     */
    String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            return responseBody;
        }
        if (root == null) {
            return null;
        }
        if (root.isTextual()) {
            return root.asText();
        }
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isObject() && message.path("content").isTextual()) {
            return message.path("content").asText();
        }
        if (message.isTextual()) {
            return message.asText();
        }
        for (String field : new String[]{"content", "text", "message"}) {
            JsonNode node = root.get(field);
            if (node != null && !node.isNull()) {
                return node.isTextual() ? node.asText() : node.toString();
            }
        }
        return null;
    }
}
