package br.edu.ifba.journal.core;

/**
 * Tunables of the journaling pipeline.
 *
 * @param contextMaxTokens token budget of the context block
 * @param topK past-entry snippets retrieved per turn
 * @param retrievalTimeoutMs time limit of semantic search
 * @param chunkTokens maximum tokens per stored chunk
 * @param generativeNluEnabled whether the model-based extractor is tried before the lexical one
 * @param nluTimeoutMs time limit per extraction strategy
 * @param nluMaxInputChars longest text sent to the model-based extractor
 * @param nluHistoryTurns prior turns given to extraction
 * @param generationMaxTokens output token ceiling of a reply
 * @param temperature reply sampling temperature
 * @param wordCeiling replies must stay below this many words
 * @param generationHistoryTurns prior turns sent with a reply request
 * @param maxRetries retries of a failed generation call
 * @param retryDelayMs delay before a retry
 * @param summaryTimeoutMs time limit of transcript summarization
 * @param gentleIntensity emotion intensity from which the gentle tone is used
 * @param acknowledgeThreshold self-awareness score from which replies acknowledge instead of probe
 * @param graphEnabled whether the knowledge graph is used at all
 * @param graphDepth hops walked from the mentioned entities
 * @param graphTimeoutMs time limit of graph calls
 * @param graphMaxFacts most graph facts returned per turn
 */
public record JournalSettings(
    int contextMaxTokens,
    int topK,
    long retrievalTimeoutMs,
    int chunkTokens,
    boolean generativeNluEnabled,
    long nluTimeoutMs,
    int nluMaxInputChars,
    int nluHistoryTurns,
    int generationMaxTokens,
    double temperature,
    int wordCeiling,
    int generationHistoryTurns,
    int maxRetries,
    long retryDelayMs,
    long summaryTimeoutMs,
    int gentleIntensity,
    double acknowledgeThreshold,
    boolean graphEnabled,
    int graphDepth,
    long graphTimeoutMs,
    int graphMaxFacts
) {

    public static JournalSettings defaults() {
        return new JournalSettings(
            1500,   // contextMaxTokens
            5,      // topK
            3000,   // retrievalTimeoutMs
            200,    // chunkTokens
            true,   // generativeNluEnabled
            8000,   // nluTimeoutMs
            2000,   // nluMaxInputChars
            4,      // nluHistoryTurns
            100,    // generationMaxTokens
            0.7,    // temperature
            50,     // wordCeiling
            10,     // generationHistoryTurns
            1,      // maxRetries
            500,    // retryDelayMs
            10000,  // summaryTimeoutMs
            4,      // gentleIntensity
            0.6,    // acknowledgeThreshold
            true,   // graphEnabled
            1,      // graphDepth
            2000,   // graphTimeoutMs
            20      // graphMaxFacts
        );
    }

    public JournalSettings withGraphEnabled(boolean enabled) {
        return new JournalSettings(
            contextMaxTokens, topK, retrievalTimeoutMs, chunkTokens,
            generativeNluEnabled, nluTimeoutMs, nluMaxInputChars, nluHistoryTurns,
            generationMaxTokens, temperature, wordCeiling, generationHistoryTurns, maxRetries, retryDelayMs,
            summaryTimeoutMs, gentleIntensity, acknowledgeThreshold,
            enabled, graphDepth, graphTimeoutMs, graphMaxFacts
        );
    }

    public JournalSettings withGenerativeNluEnabled(boolean enabled) {
        return new JournalSettings(
            contextMaxTokens, topK, retrievalTimeoutMs, chunkTokens,
            enabled, nluTimeoutMs, nluMaxInputChars, nluHistoryTurns,
            generationMaxTokens, temperature, wordCeiling, generationHistoryTurns, maxRetries, retryDelayMs,
            summaryTimeoutMs, gentleIntensity, acknowledgeThreshold,
            graphEnabled, graphDepth, graphTimeoutMs, graphMaxFacts
        );
    }

    /**
     * Settings for tests: no retry delay.
     */
    public JournalSettings withRetryDelayMs(long delayMs) {
        return new JournalSettings(
            contextMaxTokens, topK, retrievalTimeoutMs, chunkTokens,
            generativeNluEnabled, nluTimeoutMs, nluMaxInputChars, nluHistoryTurns,
            generationMaxTokens, temperature, wordCeiling, generationHistoryTurns, maxRetries, delayMs,
            summaryTimeoutMs, gentleIntensity, acknowledgeThreshold,
            graphEnabled, graphDepth, graphTimeoutMs, graphMaxFacts
        );
    }
}
