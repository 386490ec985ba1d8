package com.production.pdf_analysis.llm;

import com.production.pdf_analysis.exception.ProviderFailureException;
import com.production.pdf_analysis.exception.ProviderFailureKind;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider backed by a langchain4j {@link ChatModel}; used for every vendor that exposes an
 * OpenAI-compatible endpoint (Gemini, Perplexity).
 */
public class ChatModelProvider implements LlmProvider {

    private final ProviderSpec spec;
    private final ChatModel chatModel;

    public ChatModelProvider(ProviderSpec spec, ChatModel chatModel) {
        this.spec = spec;
        this.chatModel = chatModel;
    }

    @Override
    public String name() {
        return spec.name();
    }

    public ProviderSpec spec() {
        return spec;
    }

    @Override
    public String generate(String prompt, String systemPrompt) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(prompt));

        ChatResponse response;
        try {
            response = chatModel.chat(ChatRequest.builder().messages(messages).build());
        } catch (RuntimeException e) {
            throw new ProviderFailureException(name(), classify(e), String.valueOf(e.getMessage()), e);
        }

        String content = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (content == null || content.isBlank()) {
            throw new ProviderFailureException(name(), ProviderFailureKind.EMPTY_RESPONSE, "Empty response from LLM");
        }
        return content;
    }

    /**
     * Maps a langchain4j failure onto a {@link ProviderFailureKind} by walking the cause chain.
     */
    static ProviderFailureKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof AuthenticationException) {
                return ProviderFailureKind.AUTHENTICATION;
            }
            if (t instanceof RateLimitException
                    || t instanceof InternalServerException
                    || t instanceof dev.langchain4j.exception.TimeoutException
                    || t instanceof HttpTimeoutException) {
                return ProviderFailureKind.TRANSIENT;
            }
            if (t instanceof HttpException http) {
                return classifyStatus(http.statusCode());
            }
            if (t instanceof IOException) {
                return ProviderFailureKind.TRANSIENT;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return ProviderFailureKind.OTHER;
    }

    static ProviderFailureKind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return ProviderFailureKind.AUTHENTICATION;
        }
        if (status == 429 || status == 502 || status == 503 || status == 504) {
            return ProviderFailureKind.TRANSIENT;
        }
        return ProviderFailureKind.OTHER;
    }
}
