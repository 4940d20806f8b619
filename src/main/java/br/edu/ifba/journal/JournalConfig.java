package br.edu.ifba.journal;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Configuration of the journaling pipeline.
 *
 * <p>All properties are read from application.properties with the prefix "journal".</p>
 *
 * <h2>Configuration Groups:</h2>
 * <ul>
 *   <li><b>context</b> - token budget of the assembled context block</li>
 *   <li><b>retrieval</b> - semantic search depth, timeout and chunk size</li>
 *   <li><b>nlu</b> - entity and emotion extraction</li>
 *   <li><b>generation</b> - reply generation and the reply format contract</li>
 *   <li><b>routing</b> - tone and acknowledge-vs-probe thresholds</li>
 *   <li><b>graph</b> - knowledge graph queries</li>
 *   <li><b>storage</b> - storage back end selection</li>
 * </ul>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * journal.context.max-tokens=1500
 * journal.retrieval.top-k=5
 * journal.routing.acknowledge-threshold=0.6
 * journal.graph.enabled=true
 * journal.storage.backend=sqlite
 * journal.storage.sqlite.path=data/journal.db
 * }</pre>
 */
@ConfigMapping(prefix = "journal")
public interface JournalConfig {

    Context context();

    Retrieval retrieval();

    Nlu nlu();

    Generation generation();

    Routing routing();

    Graph graph();

    Storage storage();

    /**
     * Size of the worker pool running retrieval and NLU concurrently.
     */
    @WithName("worker-threads")
    @WithDefault("8")
    @Min(2)
    int workerThreads();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (context().maxTokens() < 1) {
            throw new IllegalArgumentException(
                String.format("Context max tokens must be positive, got %d", context().maxTokens())
            );
        }

        if (retrieval().topK() < 1) {
            throw new IllegalArgumentException(
                String.format("Retrieval top-k must be positive, got %d", retrieval().topK())
            );
        }

        if (generation().wordCeiling() < 2) {
            throw new IllegalArgumentException(
                String.format("Reply word ceiling must be at least 2, got %d", generation().wordCeiling())
            );
        }

        if (routing().gentleIntensity() < 1 || routing().gentleIntensity() > 5) {
            throw new IllegalArgumentException(
                String.format("Gentle intensity threshold must be within 1..5, got %d", routing().gentleIntensity())
            );
        }

        if (routing().acknowledgeThreshold() < 0.0 || routing().acknowledgeThreshold() > 1.0) {
            throw new IllegalArgumentException(
                String.format("Acknowledge threshold must be within [0, 1], got %.2f", routing().acknowledgeThreshold())
            );
        }

        String backend = storage().backend();
        if (!"memory".equalsIgnoreCase(backend) && !"sqlite".equalsIgnoreCase(backend)) {
            throw new IllegalArgumentException(
                String.format("Unknown storage backend '%s', expected 'memory' or 'sqlite'", backend)
            );
        }
    }

    interface Context {
        /**
         * Token budget of the context block handed to generation.
         *
         * @return max context tokens, default 1500
         */
        @WithName("max-tokens")
        @WithDefault("1500")
        @Min(1)
        int maxTokens();
    }

    interface Retrieval {
        @WithName("top-k")
        @WithDefault("5")
        @Min(1)
        int topK();

        @WithName("timeout-ms")
        @WithDefault("3000")
        long timeoutMs();

        /**
         * Maximum tokens per summary chunk at write time.
         */
        @WithName("chunk-tokens")
        @WithDefault("200")
        @Min(16)
        int chunkTokens();
    }

    interface Nlu {
        /**
         * When false only the lexical tagger is used.
         */
        @WithName("generative-enabled")
        @WithDefault("true")
        boolean generativeEnabled();

        @WithName("timeout-ms")
        @WithDefault("8000")
        long timeoutMs();

        @WithName("max-input-chars")
        @WithDefault("2000")
        @Min(100)
        int maxInputChars();

        /**
         * Number of recent turns sent along with the text to extract from.
         */
        @WithName("history-turns")
        @WithDefault("4")
        @Min(0)
        int historyTurns();
    }

    interface Generation {
        /**
         * Output token ceiling of one reply.
         *
         * @return max reply tokens, default 100
         */
        @WithName("max-tokens")
        @WithDefault("100")
        @Min(10)
        int maxTokens();

        @WithDefault("0.7")
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        double temperature();

        /**
         * Replies must stay below this many words.
         */
        @WithName("word-ceiling")
        @WithDefault("50")
        int wordCeiling();

        @WithName("history-turns")
        @WithDefault("10")
        @Min(0)
        int historyTurns();

        /**
         * Extra attempts after a failed generation call.
         */
        @WithName("max-retries")
        @WithDefault("1")
        @Min(0)
        @Max(3)
        int maxRetries();

        @WithName("retry-delay-ms")
        @WithDefault("500")
        @Min(0)
        long retryDelayMs();

        @WithName("summary-timeout-ms")
        @WithDefault("10000")
        long summaryTimeoutMs();
    }

    interface Routing {
        /**
         * Emotion intensity from which the gentle tone is used.
         */
        @WithName("gentle-intensity")
        @WithDefault("4")
        int gentleIntensity();

        /**
         * Self-awareness score from which the reply acknowledges instead of probing.
         */
        @WithName("acknowledge-threshold")
        @WithDefault("0.6")
        double acknowledgeThreshold();
    }

    interface Graph {
        /**
         * When false the graph is neither queried nor written.
         */
        @WithDefault("true")
        boolean enabled();

        @WithDefault("1")
        @Min(1)
        @Max(3)
        int depth();

        @WithName("timeout-ms")
        @WithDefault("2000")
        long timeoutMs();

        @WithName("max-facts")
        @WithDefault("20")
        @Min(1)
        int maxFacts();
    }

    interface Storage {
        /**
         * Storage back end: {@code memory} or {@code sqlite}.
         */
        @WithDefault("memory")
        String backend();

        Sqlite sqlite();

        interface Sqlite {
            @WithDefault("data/journal.db")
            String path();

            @WithName("read-pool-size")
            @WithDefault("4")
            @Min(1)
            int readPoolSize();

            @WithName("busy-timeout-ms")
            @WithDefault("30000")
            long busyTimeoutMs();

            @WithName("wal-mode")
            @WithDefault("true")
            boolean walMode();
        }
    }
}
