package br.edu.ifba.journal.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Token counting and token-bounded text slicing.
 *
 * <p>Uses jtokkit with the cl100k_base encoding when available and falls back to a
 * four-characters-per-token approximation otherwise.</p>
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    private static final double AVG_CHARS_PER_TOKEN = 4.0;

    private static volatile Encoding encoding;
    private static volatile boolean initializationFailed = false;

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @Nullable
    private static Encoding getEncoding() {
        if (encoding == null && !initializationFailed) {
            synchronized (TokenUtil.class) {
                if (encoding == null && !initializationFailed) {
                    try {
                        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
                        encoding = registry.getEncoding(EncodingType.CL100K_BASE);
                        logger.info("Initialized jtokkit with cl100k_base encoding");
                    } catch (RuntimeException e) {
                        initializationFailed = true;
                        logger.warn("Failed to initialize jtokkit, falling back to approximation: {}", e.getMessage());
                    }
                }
            }
        }
        return encoding;
    }

    /**
     * Counts tokens of a text.
     */
    public static int estimateTokens(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }

        Encoding enc = getEncoding();
        if (enc != null) {
            return enc.countTokens(text);
        }
        return estimateTokensApproximate(text);
    }

    public static int estimateTokensApproximate(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / AVG_CHARS_PER_TOKEN);
    }

    /**
     * Cuts a text to at most {@code maxTokens} tokens, marking the cut with an ellipsis.
     */
    @NotNull
    public static String truncateToTokenLimit(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            return "";
        }
        if (estimateTokens(text) <= maxTokens) {
            return text;
        }

        Encoding enc = getEncoding();
        if (enc != null) {
            IntArrayList tokens = enc.encode(text);
            int truncateAt = Math.max(0, maxTokens - 1);
            IntArrayList truncated = new IntArrayList(truncateAt);
            for (int i = 0; i < truncateAt && i < tokens.size(); i++) {
                truncated.add(tokens.get(i));
            }
            return enc.decode(truncated) + "...";
        }

        int targetChars = (int) (maxTokens * AVG_CHARS_PER_TOKEN);
        if (targetChars >= text.length()) {
            return text;
        }
        return text.substring(0, Math.max(0, targetChars - 3)) + "...";
    }

    /**
     * Packs whole sentences into slices of at most {@code maxTokens} tokens. A sentence longer
     * than the limit is split on token boundaries.
     *
     * @throws IllegalArgumentException if maxTokens is not positive
     */
    @NotNull
    public static List<String> chunkText(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }

        List<String> chunks = new ArrayList<>();
        if (text.isBlank()) {
            return chunks;
        }

        String[] sentences = text.trim().split("(?<=[.!?])\\s+");
        StringBuilder currentChunk = new StringBuilder();
        int currentTokens = 0;

        for (String sentence : sentences) {
            int sentenceTokens = estimateTokens(sentence);

            if (sentenceTokens > maxTokens) {
                if (currentChunk.length() > 0) {
                    chunks.add(currentChunk.toString().trim());
                    currentChunk = new StringBuilder();
                    currentTokens = 0;
                }
                chunks.addAll(chunkByTokens(sentence, maxTokens));
                continue;
            }

            if (currentTokens + sentenceTokens > maxTokens && currentChunk.length() > 0) {
                chunks.add(currentChunk.toString().trim());
                currentChunk = new StringBuilder();
                currentTokens = 0;
            }

            currentChunk.append(sentence).append(' ');
            currentTokens += sentenceTokens;
        }

        if (currentChunk.length() > 0) {
            chunks.add(currentChunk.toString().trim());
        }
        return chunks;
    }

    @NotNull
    private static List<String> chunkByTokens(@NotNull String text, int maxTokens) {
        List<String> chunks = new ArrayList<>();

        Encoding enc = getEncoding();
        if (enc != null) {
            IntArrayList tokens = enc.encode(text);
            for (int i = 0; i < tokens.size(); i += maxTokens) {
                int end = Math.min(i + maxTokens, tokens.size());
                IntArrayList chunkTokens = new IntArrayList(end - i);
                for (int j = i; j < end; j++) {
                    chunkTokens.add(tokens.get(j));
                }
                chunks.add(enc.decode(chunkTokens));
            }
            return chunks;
        }

        int maxChars = (int) (maxTokens * AVG_CHARS_PER_TOKEN);
        for (int i = 0; i < text.length(); i += maxChars) {
            chunks.add(text.substring(i, Math.min(i + maxChars, text.length())));
        }
        return chunks;
    }
}
