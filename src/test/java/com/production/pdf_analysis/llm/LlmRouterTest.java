package com.production.pdf_analysis.llm;

import com.production.pdf_analysis.exception.ProviderExhaustedException;
import com.production.pdf_analysis.exception.ProviderFailureException;
import com.production.pdf_analysis.exception.ProviderFailureKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmRouterTest {

    private final List<Long> pauses = new ArrayList<>();
    private final Sleeper recordingSleeper = pauses::add;
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void transientFailuresAreRetriedOnTheSameProvider() {
        ScriptedProvider gemini = new ScriptedProvider("gemini",
                ProviderFailureKind.TRANSIENT, ProviderFailureKind.TRANSIENT, "{\"ok\":true}");
        ScriptedProvider perplexity = new ScriptedProvider("perplexity", "unused");

        LlmResponse response = router(3, gemini, perplexity).generate("prompt", "system");

        assertThat(response.providerName()).isEqualTo("gemini");
        assertThat(response.content()).isEqualTo("{\"ok\":true}");
        assertThat(gemini.calls).isEqualTo(3);
        assertThat(perplexity.calls).isZero();
        assertThat(pauses).containsExactly(100L, 200L);
    }

    @Test
    void retryBudgetExhaustionMovesToNextProvider() {
        ScriptedProvider gemini = new ScriptedProvider("gemini",
                ProviderFailureKind.TRANSIENT, ProviderFailureKind.TRANSIENT);
        ScriptedProvider perplexity = new ScriptedProvider("perplexity", "answer");

        LlmResponse response = router(2, gemini, perplexity).generate("prompt", null);

        assertThat(response.providerName()).isEqualTo("perplexity");
        assertThat(gemini.calls).isEqualTo(2);
        assertThat(pauses).containsExactly(100L);
    }

    @Test
    void authenticationFailureFailsOverWithoutRetry() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", ProviderFailureKind.AUTHENTICATION);
        ScriptedProvider perplexity = new ScriptedProvider("perplexity", "answer");

        LlmResponse response = router(3, gemini, perplexity).generate("prompt", null);

        assertThat(response.providerName()).isEqualTo("perplexity");
        assertThat(gemini.calls).isEqualTo(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    void blankAnswerFailsOverToNextProvider() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", "   ");
        ScriptedProvider gigachat = new ScriptedProvider("gigachat", "answer");

        LlmResponse response = router(3, gemini, gigachat).generate("prompt", null);

        assertThat(response.providerName()).isEqualTo("gigachat");
        assertThat(gemini.calls).isEqualTo(1);
    }

    @Test
    void exhaustionCarriesEveryFailureInOrder() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", ProviderFailureKind.AUTHENTICATION);
        ScriptedProvider perplexity = new ScriptedProvider("perplexity",
                ProviderFailureKind.TRANSIENT, ProviderFailureKind.OTHER);
        ScriptedProvider gigachat = new ScriptedProvider("gigachat", ProviderFailureKind.EMPTY_RESPONSE);

        assertThatThrownBy(() -> router(3, gemini, perplexity, gigachat).generate("prompt", null))
                .isInstanceOfSatisfying(ProviderExhaustedException.class, e -> assertThat(e.getFailures())
                        .extracting(ProviderFailureException::getProviderName)
                        .containsExactly("gemini", "perplexity", "perplexity", "gigachat"));
    }

    @Test
    void unexpectedExceptionIsClassifiedAsOther() {
        LlmProvider broken = new LlmProvider() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String generate(String prompt, String systemPrompt) {
                throw new IllegalStateException("boom");
            }
        };

        assertThatThrownBy(() -> new LlmRouter(List.of(broken), Runnable::run, Duration.ofSeconds(5), 3, 100,
                recordingSleeper).generate("prompt", null))
                .isInstanceOfSatisfying(ProviderExhaustedException.class, e -> {
                    assertThat(e.getFailures()).hasSize(1);
                    assertThat(e.getFailures().get(0).getFailureKind()).isEqualTo(ProviderFailureKind.OTHER);
                });
    }

    @Test
    void noProvidersMeansExhaustedImmediately() {
        LlmRouter router = router(3);

        assertThat(router.hasProviders()).isFalse();
        assertThatThrownBy(() -> router.generate("prompt", null))
                .isInstanceOf(ProviderExhaustedException.class)
                .hasMessageContaining("No LLM providers configured");
    }

    @Test
    void overrunDeadlineIsTransient() {
        pool = Executors.newCachedThreadPool();
        LlmProvider slow = new LlmProvider() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public String generate(String prompt, String systemPrompt) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            }
        };
        ScriptedProvider fallback = new ScriptedProvider("fallback", "answer");
        LlmRouter router = new LlmRouter(List.of(slow, fallback), pool, Duration.ofMillis(50), 1, 100,
                recordingSleeper);

        LlmResponse response = router.generate("prompt", null);

        assertThat(response.providerName()).isEqualTo("fallback");
    }

    @Test
    void rejectedCallIsATransientFailure() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", "never reached");
        LlmRouter router = new LlmRouter(List.of(gemini), task -> {
            throw new RejectedExecutionException("queue full");
        }, Duration.ofSeconds(5), 2, 100, recordingSleeper);

        assertThatThrownBy(() -> router.generate("prompt", null))
                .isInstanceOfSatisfying(ProviderExhaustedException.class, e -> assertThat(e.getFailures())
                        .extracting(ProviderFailureException::getFailureKind)
                        .containsExactly(ProviderFailureKind.TRANSIENT, ProviderFailureKind.TRANSIENT));
        assertThat(gemini.calls).isZero();
        assertThat(pauses).containsExactly(100L);
    }

    @Test
    void backoffDoublesPerAttempt() {
        LlmRouter router = router(3);

        assertThat(router.backoffMillis(1)).isEqualTo(100);
        assertThat(router.backoffMillis(2)).isEqualTo(200);
        assertThat(router.backoffMillis(3)).isEqualTo(400);
    }

    @Test
    void providerNamesFollowChainOrder() {
        LlmRouter router = router(1, new ScriptedProvider("gemini"), new ScriptedProvider("gigachat"));

        assertThat(router.providerNames()).containsExactly("gemini", "gigachat");
    }

    private LlmRouter router(int maxRetries, LlmProvider... providers) {
        return new LlmRouter(Arrays.asList(providers), Runnable::run, Duration.ofSeconds(5), maxRetries, 100,
                recordingSleeper);
    }

    /** Replays a fixed script: a {@link ProviderFailureKind} entry fails, a string entry answers. */
    private static final class ScriptedProvider implements LlmProvider {

        private final String name;
        private final Deque<Object> script;
        private int calls;

        ScriptedProvider(String name, Object... script) {
            this.name = name;
            this.script = new ArrayDeque<>(Arrays.asList(script));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String generate(String prompt, String systemPrompt) {
            calls++;
            Object next = script.isEmpty() ? ProviderFailureKind.OTHER : script.poll();
            if (next instanceof ProviderFailureKind kind) {
                throw new ProviderFailureException(name, kind, "scripted " + kind);
            }
            return (String) next;
        }
    }
}
