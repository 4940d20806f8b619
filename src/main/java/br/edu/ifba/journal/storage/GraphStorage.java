package br.edu.ifba.journal.storage;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Owner-scoped property graph with merge-by-key writes.
 *
 * <p>Node identity is (owner, label, name); edge identity is (owner, source, type, target).
 * Upserting an existing node key is a no-op; upserting an existing edge key overwrites its
 * sub-type, so repeated or out-of-order writes never duplicate anything.</p>
 */
public interface GraphStorage extends AutoCloseable {

    CompletableFuture<Void> initialize();

    /**
     * Declares the uniqueness constraints. Safe to call when they already exist.
     */
    CompletableFuture<Void> declareConstraints();

    CompletableFuture<Void> upsertNodes(@NotNull List<GraphNode> nodes);

    CompletableFuture<Void> upsertEdges(@NotNull List<GraphEdge> edges);

    /**
     * Finds nodes of the owner by name, case-insensitively, across labels.
     */
    CompletableFuture<List<GraphNode>> findNodesByName(@NotNull String ownerId, @NotNull List<String> names);

    /**
     * Edges of the owner touching the node, in either direction.
     */
    CompletableFuture<List<GraphEdge>> edgesOf(@NotNull GraphNode node);

    CompletableFuture<GraphStats> getStats(@NotNull String ownerId);

    @Override
    void close();

    enum NodeLabel {
        USER, ENTRY, PERSON, ENTITY, EMOTION
    }

    enum EdgeType {
        AUTHORED, MENTIONS, FEELS, RELATES_TO
    }

    /**
     * Graph node. Names are normalised to lower case for identity; {@code displayName} keeps the
     * casing seen first.
     */
    record GraphNode(
        @NotNull String ownerId,
        @NotNull NodeLabel label,
        @NotNull String name,
        @NotNull String displayName
    ) {
        public GraphNode {
            Objects.requireNonNull(ownerId, "ownerId must not be null");
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(displayName, "displayName must not be null");
            name = normalize(Objects.requireNonNull(name, "name must not be null"));
        }

        public static GraphNode of(@NotNull String ownerId, @NotNull NodeLabel label, @NotNull String name) {
            return new GraphNode(ownerId, label, name, name.trim());
        }

        /**
         * Identity key, independent of display casing.
         */
        @NotNull
        public String key() {
            return ownerId + "|" + label + "|" + name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof GraphNode other)) {
                return false;
            }
            return key().equals(other.key());
        }

        @Override
        public int hashCode() {
            return key().hashCode();
        }

        public static String normalize(String name) {
            return name.trim().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Directed typed edge. The sub-type is an attribute, not part of the identity: it carries the
     * relation label of {@code RELATES_TO} edges and the valence of {@code FEELS} edges.
     */
    record GraphEdge(
        @NotNull GraphNode source,
        @NotNull EdgeType type,
        @NotNull GraphNode target,
        @NotNull String subtype
    ) {
        public GraphEdge {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(target, "target must not be null");
            if (!source.ownerId().equals(target.ownerId())) {
                throw new IllegalArgumentException("Edge endpoints must belong to the same owner");
            }
            subtype = subtype == null ? "" : subtype.trim().toLowerCase(Locale.ROOT);
        }

        public static GraphEdge of(@NotNull GraphNode source, @NotNull EdgeType type, @NotNull GraphNode target) {
            return new GraphEdge(source, type, target, "");
        }

        @NotNull
        public String ownerId() {
            return source.ownerId();
        }

        @NotNull
        public String key() {
            return source.key() + "-[" + type + "]->" + target.key();
        }

        /**
         * The endpoint opposite to {@code node}.
         */
        @NotNull
        public GraphNode otherEnd(@NotNull GraphNode node) {
            return source.equals(node) ? target : source;
        }
    }

    record GraphStats(int nodeCount, int edgeCount) {}
}
