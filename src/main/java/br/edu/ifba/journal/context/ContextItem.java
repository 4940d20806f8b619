package br.edu.ifba.journal.context;

import org.jetbrains.annotations.NotNull;

/**
 * A single rendered line of context with its token cost.
 *
 * @param content the rendered text of this item
 * @param kind where the item came from; also its priority class
 * @param sourceId chunk id, fact key or {@code "current"}
 * @param tokens token count of {@code content}
 */
public record ContextItem(
    @NotNull String content,
    @NotNull Kind kind,
    @NotNull String sourceId,
    int tokens
) {

    /**
     * Priority classes, highest first.
     */
    public enum Kind {
        CURRENT,
        SEMANTIC,
        GRAPH
    }

    public static ContextItem current(@NotNull String content, int tokens) {
        return new ContextItem(content, Kind.CURRENT, "current", tokens);
    }

    public static ContextItem semantic(@NotNull String chunkId, @NotNull String content, int tokens) {
        return new ContextItem(content, Kind.SEMANTIC, chunkId, tokens);
    }

    public static ContextItem graph(@NotNull String factKey, @NotNull String content, int tokens) {
        return new ContextItem(content, Kind.GRAPH, factKey, tokens);
    }

    public boolean isSemantic() {
        return kind == Kind.SEMANTIC;
    }

    public boolean isGraph() {
        return kind == Kind.GRAPH;
    }
}
