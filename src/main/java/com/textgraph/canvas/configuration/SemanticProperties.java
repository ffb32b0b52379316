package com.textgraph.canvas.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Semantic expansion settings: how many words to expand, cache TTL and one block per source.
 *
 * <p>Example:
 * <pre>
 * app:
 *   semantic:
 *     max-words: 20
 *     cache:
 *       ttl: 24h
 *     local-reasoner:
 *       enabled: true
 *       base-url: http://localhost:11434
 *       timeout: 10s
 *     encyclopedia:
 *       timeout: 5s
 * </pre>
 */
@Data
public class SemanticProperties {

    @Min(0)
    private int maxWords = 20;

    @Valid
    @NotNull
    private Cache cache = new Cache();

    @Valid
    @NotNull
    private LocalReasoner localReasoner = new LocalReasoner();

    @Valid
    @NotNull
    private LexicalDb lexicalDb = new LexicalDb();

    @Valid
    @NotNull
    private Encyclopedia encyclopedia = new Encyclopedia();

    @Valid
    @NotNull
    private StaticFallback staticFallback = new StaticFallback();

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class LocalReasoner {
        private boolean enabled = true;

        @NotBlank
        private String baseUrl = "http://localhost:11434";

        @NotBlank
        private String model = "llama2";

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Low temperature keeps the extraction output stable between calls.
         */
        private double temperature = 0.3;

        @Min(1)
        private int numPredict = 200;
    }

    @Data
    public static class LexicalDb {
        private boolean enabled = true;

        @NotBlank
        private String location = "classpath:lexicon/lexical-db.json";
    }

    @Data
    public static class Encyclopedia {
        private boolean enabled = true;

        @NotBlank
        private String baseUrl = "https://en.wikipedia.org/api/rest_v1";

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class StaticFallback {
        private boolean enabled = true;
    }
}
