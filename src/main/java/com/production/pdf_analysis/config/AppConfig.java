package com.production.pdf_analysis.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "")
@Getter
@Setter
@Slf4j
public class AppConfig {

    private Extraction extraction = new Extraction();
    private Toc toc = new Toc();
    private Readtime readtime = new Readtime();
    private Analysis analysis = new Analysis();
    private Llm llm = new Llm();
    private Batch batch = new Batch();

    @Getter
    @Setter
    public static class Extraction {
        /** "first" extracts page 1 only, "full" joins every page. */
        private String textPages = "first";
        private int connectTimeoutSeconds = 10;
        private int downloadTimeoutSeconds = 20;
        private int maxPromptChars = 20000;

        public boolean isFullText() {
            return "full".equalsIgnoreCase(textPages);
        }
    }

    @Getter
    @Setter
    public static class Toc {
        private boolean enabled = true;
        private int maxPages = 3;
        private int maxChars = 1500;
    }

    @Getter
    @Setter
    public static class Readtime {
        private String mode = "accurate";
        private int maxPages = 200;
        /** "low,high" seconds per image. */
        private String perImageSeconds = "3,10";

        /**
         * Parses {@link #perImageSeconds}; anything other than two integers yields the defaults.
         */
        public int[] resolvePerImageSeconds() {
            if (perImageSeconds == null || perImageSeconds.isBlank()) {
                return new int[]{3, 10};
            }
            String[] parts = perImageSeconds.split(",");
            if (parts.length != 2) {
                log.warn("Invalid readtime.per-image-seconds '{}', using 3,10", perImageSeconds);
                return new int[]{3, 10};
            }
            try {
                return new int[]{
                        Math.max(0, Integer.parseInt(parts[0].trim())),
                        Math.max(0, Integer.parseInt(parts[1].trim()))
                };
            } catch (NumberFormatException e) {
                log.warn("Invalid readtime.per-image-seconds '{}', using 3,10", perImageSeconds);
                return new int[]{3, 10};
            }
        }
    }

    @Getter
    @Setter
    public static class Analysis {
        private int timeoutSeconds = 60;
        private String defaultLanguage = "ru";
        /** Skips the LLM entirely and answers with the heuristic analysis. */
        private boolean mockEnabled = false;
        private Heuristic heuristic = new Heuristic();

        @Getter
        @Setter
        public static class Heuristic {
            private boolean filenameCategories = true;
            private Map<String, List<String>> categories = defaultCategories();

            private static Map<String, List<String>> defaultCategories() {
                Map<String, List<String>> map = new LinkedHashMap<>();
                map.put("Technology", List.of("tech", "programming", "code", "dev", "github"));
                map.put("Machine Learning", List.of("ml", "ai", "machine", "learning", "neural", "data"));
                map.put("Science", List.of("science", "research", "paper", "journal"));
                map.put("Business", List.of("business", "economy", "finance", "market"));
                return map;
            }
        }
    }

    @Getter
    @Setter
    public static class Llm {
        private int maxRetries = 3;
        private long backoffBaseMs = 2000;
        private int callTimeoutSeconds = 30;
        private OpenAiCompatible gemini = new OpenAiCompatible(
                "https://generativelanguage.googleapis.com/v1beta/openai/", "gemini-2.5-flash-lite");
        private OpenAiCompatible perplexity = new OpenAiCompatible(
                "https://api.perplexity.ai", "sonar");
        private GigaChat gigachat = new GigaChat();

        @Getter
        @Setter
        public static class OpenAiCompatible {
            private String apiKey;
            private String baseUrl;
            private String model;

            public OpenAiCompatible() {
            }

            public OpenAiCompatible(String baseUrl, String model) {
                this.baseUrl = baseUrl;
                this.model = model;
            }
        }

        @Getter
        @Setter
        public static class GigaChat {
            /** Base64 "client_id:client_secret" authorization key. */
            private String authKey;
            private String scope = "GIGACHAT_API_PERS";
            private String model = "GigaChat-2";
            private String apiBase = "https://gigachat.devices.sberbank.ru/api/v1";
            private String authUrl = "https://ngw.devices.sberbank.ru:9443/api/v2/oauth";
            private double temperature = 0.7;
            /** GigaChat serves a certificate from a private CA; verification is off unless the CA is installed. */
            private boolean verifySsl = false;
        }
    }

    @Getter
    @Setter
    public static class Batch {
        private String outputDir = "./analysis-output";
        private int concurrency = 2;
    }
}
