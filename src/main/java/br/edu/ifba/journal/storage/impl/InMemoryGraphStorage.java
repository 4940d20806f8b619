package br.edu.ifba.journal.storage.impl;

import br.edu.ifba.journal.storage.GraphStorage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Graph storage backed by concurrent maps keyed by node and edge identity.
 *
 * <p>Keying the maps by identity gives the uniqueness constraints for free, so
 * {@link #declareConstraints()} only records that it ran.</p>
 */
public class InMemoryGraphStorage implements GraphStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStorage.class);

    // node key -> node
    private final ConcurrentHashMap<String, GraphNode> nodes = new ConcurrentHashMap<>();

    // edge key -> edge
    private final ConcurrentHashMap<String, GraphEdge> edges = new ConcurrentHashMap<>();

    // node key -> keys of edges touching it
    private final ConcurrentHashMap<String, Set<String>> adjacency = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;
    private final AtomicInteger constraintDeclarations = new AtomicInteger();

    @Override
    public CompletableFuture<Void> initialize() {
        if (!initialized) {
            initialized = true;
            logger.info("InMemoryGraphStorage initialized");
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> declareConstraints() {
        ensureInitialized();
        logger.debug("Graph constraints declared ({} times)", constraintDeclarations.incrementAndGet());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> upsertNodes(@NotNull List<GraphNode> batch) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            for (GraphNode node : batch) {
                nodes.putIfAbsent(node.key(), node);
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertEdges(@NotNull List<GraphEdge> batch) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            for (GraphEdge edge : batch) {
                nodes.putIfAbsent(edge.source().key(), edge.source());
                nodes.putIfAbsent(edge.target().key(), edge.target());
                // same identity with a new sub-type overwrites the stored edge
                if (edges.put(edge.key(), edge) == null) {
                    adjacency.computeIfAbsent(edge.source().key(), k -> ConcurrentHashMap.newKeySet()).add(edge.key());
                    adjacency.computeIfAbsent(edge.target().key(), k -> ConcurrentHashMap.newKeySet()).add(edge.key());
                }
            }
        });
    }

    @Override
    public CompletableFuture<List<GraphNode>> findNodesByName(@NotNull String ownerId, @NotNull List<String> names) {
        ensureInitialized();
        Set<String> wanted = new HashSet<>();
        for (String name : names) {
            wanted.add(GraphNode.normalize(name));
        }
        return CompletableFuture.completedFuture(nodes.values().stream()
            .filter(node -> node.ownerId().equals(ownerId))
            .filter(node -> wanted.contains(node.name()))
            .toList());
    }

    @Override
    public CompletableFuture<List<GraphEdge>> edgesOf(@NotNull GraphNode node) {
        ensureInitialized();
        Set<String> edgeKeys = adjacency.getOrDefault(node.key(), Set.of());
        List<GraphEdge> result = new ArrayList<>(edgeKeys.size());
        for (String key : edgeKeys) {
            GraphEdge edge = edges.get(key);
            if (edge != null && edge.ownerId().equals(node.ownerId())) {
                result.add(edge);
            }
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String ownerId) {
        ensureInitialized();
        int nodeCount = (int) nodes.values().stream().filter(n -> n.ownerId().equals(ownerId)).count();
        int edgeCount = (int) edges.values().stream().filter(e -> e.ownerId().equals(ownerId)).count();
        return CompletableFuture.completedFuture(new GraphStats(nodeCount, edgeCount));
    }

    @Override
    public void close() {
        nodes.clear();
        edges.clear();
        adjacency.clear();
        initialized = false;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
