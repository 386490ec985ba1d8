package com.production.pdf_analysis.llm;

import com.production.pdf_analysis.exception.ProviderExhaustedException;
import com.production.pdf_analysis.exception.ProviderFailureException;
import com.production.pdf_analysis.exception.ProviderFailureKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered chain of {@link LlmProvider}s with retry and failover.
 * <p>
 * Each call runs on {@code executor} with a fixed deadline. A {@link ProviderFailureKind#TRANSIENT}
 * failure (overrun deadline included) retries the same provider with exponential backoff until
 * the attempt budget is spent; every other failure moves on to the next provider at once.
 * When the chain is exhausted a {@link ProviderExhaustedException} carries every failure seen.
 */
@Slf4j
public class LlmRouter {

    private final List<LlmProvider> providers;
    private final Executor executor;
    private final Duration callTimeout;
    private final int defaultMaxRetries;
    private final long backoffBaseMs;
    private final Sleeper sleeper;

    public LlmRouter(List<LlmProvider> providers, Executor executor, Duration callTimeout,
                     int defaultMaxRetries, long backoffBaseMs, Sleeper sleeper) {
        this.providers = List.copyOf(providers);
        this.executor = executor;
        this.callTimeout = callTimeout;
        this.defaultMaxRetries = Math.max(1, defaultMaxRetries);
        this.backoffBaseMs = Math.max(0, backoffBaseMs);
        this.sleeper = sleeper;
    }

    public List<String> providerNames() {
        return providers.stream().map(LlmProvider::name).toList();
    }

    public boolean hasProviders() {
        return !providers.isEmpty();
    }

    public LlmResponse generate(String prompt, String systemPrompt) {
        return generate(prompt, systemPrompt, defaultMaxRetries);
    }

    /**
     * @param maxRetries attempts per provider, at least one
     * @throws ProviderExhaustedException when no provider produced content
     */
    public LlmResponse generate(String prompt, String systemPrompt, int maxRetries) {
        int attempts = Math.max(1, maxRetries);
        List<ProviderFailureException> failures = new ArrayList<>();

        for (LlmProvider provider : providers) {
            log.info("Trying LLM provider {}", provider.name());
            for (int attempt = 1; attempt <= attempts; attempt++) {
                long start = System.currentTimeMillis();
                try {
                    String content = call(provider, prompt, systemPrompt);
                    log.info("[TIMING] {} answered in {}ms (attempt {}/{})",
                            provider.name(), System.currentTimeMillis() - start, attempt, attempts);
                    return new LlmResponse(content, provider.name());
                } catch (ProviderFailureException e) {
                    failures.add(e);
                    if (Thread.currentThread().isInterrupted()) {
                        throw new ProviderExhaustedException(failures);
                    }
                    if (e.getFailureKind().isRetryable() && attempt < attempts) {
                        long backoff = backoffMillis(attempt);
                        log.warn("{} temporarily unavailable (attempt {}/{}): {}; retrying in {}ms",
                                provider.name(), attempt, attempts, e.getMessage(), backoff);
                        if (!pause(backoff)) {
                            throw new ProviderExhaustedException(failures);
                        }
                        continue;
                    }
                    log.warn("{} failed ({}): {}; trying next provider",
                            provider.name(), e.getFailureKind(), e.getMessage());
                    break;
                }
            }
        }

        if (failures.isEmpty()) {
            log.warn("No LLM providers configured");
        }
        throw new ProviderExhaustedException(failures);
    }

    long backoffMillis(int attempt) {
        return backoffBaseMs * (1L << Math.min(attempt - 1, 20));
    }

    private String call(LlmProvider provider, String prompt, String systemPrompt) {
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> provider.generate(prompt, systemPrompt), executor);
        } catch (RejectedExecutionException e) {
            throw new ProviderFailureException(provider.name(), ProviderFailureKind.TRANSIENT,
                    "LLM call executor saturated", e);
        }
        String content;
        try {
            content = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderFailureException(provider.name(), ProviderFailureKind.TRANSIENT,
                    "No answer within " + callTimeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderFailureException(provider.name(), ProviderFailureKind.OTHER, "Interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderFailureException pfe) {
                throw pfe;
            }
            throw new ProviderFailureException(provider.name(), ChatModelProvider.classify(cause),
                    String.valueOf(cause != null ? cause.getMessage() : e.getMessage()), cause);
        }
        if (content == null || content.isBlank()) {
            throw new ProviderFailureException(provider.name(), ProviderFailureKind.EMPTY_RESPONSE,
                    "Empty response from LLM");
        }
        return content;
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
