package com.production.pdf_analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.llm.ChatModelProvider;
import com.production.pdf_analysis.llm.LlmProvider;
import com.production.pdf_analysis.llm.LlmRouter;
import com.production.pdf_analysis.llm.ProviderSpec;
import com.production.pdf_analysis.llm.Sleeper;
import com.production.pdf_analysis.llm.gigachat.GigaChatAuthClient;
import com.production.pdf_analysis.llm.gigachat.GigaChatClient;
import com.production.pdf_analysis.llm.gigachat.GigaChatHttp;
import com.production.pdf_analysis.llm.gigachat.GigaChatTokenManager;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds the provider chain from configured credentials. Order: Gemini, Perplexity, GigaChat;
 * a provider without a credential is left out.
 */
@Configuration
@Slf4j
public class LlmConfig {

    static List<ProviderSpec> providerSpecs(AppConfig appConfig) {
        AppConfig.Llm llm = appConfig.getLlm();
        List<ProviderSpec> specs = new ArrayList<>();
        addOpenAiCompatible(specs, "gemini", llm.getGemini());
        addOpenAiCompatible(specs, "perplexity", llm.getPerplexity());
        AppConfig.Llm.GigaChat giga = llm.getGigachat();
        if (hasText(giga.getAuthKey())) {
            specs.add(new ProviderSpec(GigaChatClient.NAME, giga.getModel(), giga.getApiBase(), giga.getAuthKey(), true));
        }
        specs.forEach(spec -> log.info("LLM provider enabled: {} (model: {})", spec.name(), spec.model()));
        if (specs.isEmpty()) {
            log.warn("No LLM providers configured; analysis will use the heuristic fallback");
        }
        return specs;
    }

    @Bean
    public LlmRouter llmRouter(AppConfig appConfig,
                               ObjectMapper objectMapper,
                               @Qualifier("llmExecutor") Executor llmExecutor) {
        AppConfig.Llm llm = appConfig.getLlm();
        Duration callTimeout = Duration.ofSeconds(llm.getCallTimeoutSeconds());

        List<LlmProvider> providers = new ArrayList<>();
        for (ProviderSpec spec : providerSpecs(appConfig)) {
            if (spec.usesDirectClient()) {
                providers.add(gigaChat(llm.getGigachat(), objectMapper, callTimeout));
            } else {
                providers.add(new ChatModelProvider(spec, OpenAiChatModel.builder()
                        .baseUrl(spec.baseUrl())
                        .apiKey(spec.credential())
                        .modelName(spec.model())
                        .timeout(callTimeout)
                        // retries belong to the router
                        .maxRetries(0)
                        .build()));
            }
        }
        return new LlmRouter(providers, llmExecutor, callTimeout,
                llm.getMaxRetries(), llm.getBackoffBaseMs(), Sleeper.THREAD);
    }

    private LlmProvider gigaChat(AppConfig.Llm.GigaChat config, ObjectMapper objectMapper, Duration timeout) {
        HttpClient httpClient = GigaChatHttp.newClient(config, Duration.ofSeconds(10));
        Clock clock = Clock.systemUTC();
        GigaChatTokenManager tokenManager = new GigaChatTokenManager(
                new GigaChatAuthClient(config, httpClient, objectMapper, clock, timeout), clock);
        return new GigaChatClient(config, httpClient, tokenManager, objectMapper, timeout);
    }

    private static void addOpenAiCompatible(List<ProviderSpec> specs, String name,
                                            AppConfig.Llm.OpenAiCompatible config) {
        if (hasText(config.getApiKey())) {
            specs.add(new ProviderSpec(name, config.getModel(), config.getBaseUrl(), config.getApiKey(), false));
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
