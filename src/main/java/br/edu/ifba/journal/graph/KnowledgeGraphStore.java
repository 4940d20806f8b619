package br.edu.ifba.journal.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.EntityType;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.GraphFact;
import br.edu.ifba.journal.storage.GraphStorage;
import br.edu.ifba.journal.storage.GraphStorage.EdgeType;
import br.edu.ifba.journal.storage.GraphStorage.GraphEdge;
import br.edu.ifba.journal.storage.GraphStorage.GraphNode;
import br.edu.ifba.journal.storage.GraphStorage.NodeLabel;

/**
 * The per-user knowledge graph: what an entry mentions, what the writer felt, and how the
 * mentioned things relate.
 *
 * <h2>Shape</h2>
 * <pre>
 * (USER owner) -AUTHORED-> (ENTRY id)
 * (ENTRY id)   -MENTIONS-> (PERSON name) | (ENTITY name)
 * (ENTRY id)   -FEELS[valence]-> (EMOTION name)
 * (PERSON|ENTITY) -RELATES_TO[type]-> (PERSON|ENTITY)
 * </pre>
 *
 * <p>Writes merge by key, so repeating an upsert changes nothing. Reads never fail: an
 * unreachable store yields no facts.</p>
 */
public class KnowledgeGraphStore {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphStore.class);

    static final String MENTIONED_WITH = "mentioned_with";
    static final String EVOKED = "evoked";

    private final GraphStorage storage;
    private final long timeoutMs;
    private final int maxFacts;

    public KnowledgeGraphStore(@NotNull GraphStorage storage, long timeoutMs, int maxFacts) {
        this.storage = storage;
        this.timeoutMs = timeoutMs;
        this.maxFacts = maxFacts;
    }

    /**
     * (Re-)declares node and edge uniqueness. Safe to call repeatedly.
     */
    public void declareConstraints() {
        storage.declareConstraints().join();
        logger.info("Knowledge graph constraints declared");
    }

    /**
     * Merges the fact set of one entry into the owner's graph.
     */
    @NotNull
    public CompletableFuture<Void> upsertFacts(@NotNull String ownerId, @NotNull UUID entryId, @NotNull ExtractedFact fact) {
        GraphNode user = GraphNode.of(ownerId, NodeLabel.USER, ownerId);
        GraphNode entry = GraphNode.of(ownerId, NodeLabel.ENTRY, entryId.toString());

        // node key -> node, so a person and a place sharing a name stay apart
        Map<String, GraphNode> entities = new LinkedHashMap<>();
        for (ExtractedFact.Mention mention : fact.entities()) {
            if (mention.name().isBlank()) {
                continue;
            }
            GraphNode node = GraphNode.of(ownerId, labelFor(mention.type()), mention.name());
            entities.putIfAbsent(node.key(), node);
        }

        List<GraphEdge> edges = new ArrayList<>();
        edges.add(GraphEdge.of(user, EdgeType.AUTHORED, entry));
        for (GraphNode node : entities.values()) {
            edges.add(GraphEdge.of(entry, EdgeType.MENTIONS, node));
        }
        for (ExtractedFact.Emotion emotion : fact.emotions()) {
            GraphNode node = GraphNode.of(ownerId, NodeLabel.EMOTION, emotion.name());
            edges.add(new GraphEdge(entry, EdgeType.FEELS, node, emotion.valence().label()));
        }
        for (ExtractedFact.Relationship relationship : fact.relationships()) {
            GraphNode source = resolve(ownerId, entities, relationship.source());
            GraphNode target = resolve(ownerId, entities, relationship.target());
            if (source.equals(target)) {
                continue;
            }
            edges.add(new GraphEdge(source, EdgeType.RELATES_TO, target, relationship.type()));
        }

        List<GraphNode> nodes = new ArrayList<>();
        nodes.add(user);
        nodes.add(entry);
        nodes.addAll(entities.values());

        return storage.upsertNodes(nodes)
            .thenCompose(ignored -> storage.upsertEdges(edges))
            .thenRun(() -> logger.debug("Upserted {} nodes and {} edges for entry {}",
                nodes.size(), edges.size(), entryId));
    }

    /**
     * Facts within {@code depth} hops of the named entities, nearest first.
     *
     * <p>Entry nodes are passed through rather than reported: two things mentioned in the same
     * entry are one hop apart ({@code mentioned_with}), as are a thing and a feeling recorded with
     * it ({@code evoked}). The owner's own node is never traversed.</p>
     *
     * @return at most the configured number of facts; empty when the store is unreachable
     */
    @NotNull
    public List<GraphFact> related(@NotNull String ownerId, @NotNull List<String> entityNames, int depth) {
        if (entityNames.isEmpty() || depth < 1) {
            return List.of();
        }
        try {
            return walk(ownerId, entityNames, depth);
        } catch (RuntimeException e) {
            logger.warn("Knowledge graph query failed for owner {}: {}", ownerId, e.getMessage());
            return List.of();
        }
    }

    @NotNull
    public GraphStorage.GraphStats stats(@NotNull String ownerId) {
        return await(storage.getStats(ownerId));
    }

    private List<GraphFact> walk(String ownerId, List<String> entityNames, int depth) {
        Map<String, String> anchorOf = new HashMap<>();
        List<GraphNode> frontier = new ArrayList<>();
        for (GraphNode node : await(storage.findNodesByName(ownerId, entityNames))) {
            if (node.label() == NodeLabel.USER || node.label() == NodeLabel.ENTRY) {
                continue;
            }
            anchorOf.put(node.key(), node.displayName());
            frontier.add(node);
        }

        Set<String> visited = new HashSet<>(anchorOf.keySet());
        Map<String, GraphFact> facts = new LinkedHashMap<>();

        for (int hop = 1; hop <= depth && !frontier.isEmpty(); hop++) {
            List<GraphNode> next = new ArrayList<>();
            for (GraphNode node : frontier) {
                String anchor = anchorOf.get(node.key());
                for (GraphEdge edge : await(storage.edgesOf(node))) {
                    GraphNode other = edge.otherEnd(node);
                    if (other.label() == NodeLabel.USER) {
                        continue;
                    }
                    if (other.label() == NodeLabel.ENTRY) {
                        for (GraphEdge viaEntry : await(storage.edgesOf(other))) {
                            GraphNode neighbour = viaEntry.otherEnd(other);
                            if (neighbour.equals(node)
                                || neighbour.label() == NodeLabel.USER
                                || neighbour.label() == NodeLabel.ENTRY) {
                                continue;
                            }
                            String relation = viaEntry.type() == EdgeType.FEELS ? EVOKED : MENTIONED_WITH;
                            record(facts, new GraphFact(anchor, node.displayName(), relation,
                                neighbour.displayName(), neighbour.label().name(), hop));
                            enqueue(neighbour, anchor, visited, anchorOf, next);
                        }
                        continue;
                    }

                    String relation = edge.type() == EdgeType.RELATES_TO && !edge.subtype().isEmpty()
                        ? edge.subtype()
                        : edge.type().name().toLowerCase(Locale.ROOT);
                    record(facts, new GraphFact(anchor, edge.source().displayName(), relation,
                        edge.target().displayName(), other.label().name(), hop));
                    enqueue(other, anchor, visited, anchorOf, next);
                }
            }
            frontier = next;
        }

        List<GraphFact> ordered = new ArrayList<>(facts.values());
        ordered.sort(GraphFact.PRIORITY);
        List<GraphFact> result = ordered.size() > maxFacts ? ordered.subList(0, maxFacts) : ordered;
        logger.debug("Graph walk for owner {} from {} anchors found {} facts", ownerId, anchorOf.size(), result.size());
        return List.copyOf(result);
    }

    private static void record(Map<String, GraphFact> facts, GraphFact fact) {
        // the same edge can be reached from both ends; keep the nearest sighting
        String a = fact.subject().toLowerCase(Locale.ROOT);
        String b = fact.object().toLowerCase(Locale.ROOT);
        String key = (a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a) + "|" + fact.relation();
        facts.merge(key, fact, (existing, candidate) ->
            GraphFact.PRIORITY.compare(candidate, existing) < 0 ? candidate : existing);
    }

    private static void enqueue(GraphNode node, String anchor, Set<String> visited,
                                Map<String, String> anchorOf, List<GraphNode> next) {
        if (visited.add(node.key())) {
            anchorOf.put(node.key(), anchor);
            next.add(node);
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        return future.copy().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
    }

    private static NodeLabel labelFor(EntityType type) {
        return type == EntityType.PERSON ? NodeLabel.PERSON : NodeLabel.ENTITY;
    }

    /**
     * The first mentioned node with this name, in mention order; an {@code ENTITY} node otherwise.
     */
    private static GraphNode resolve(String ownerId, Map<String, GraphNode> entities, String name) {
        String normalized = GraphNode.normalize(name);
        for (GraphNode known : entities.values()) {
            if (known.name().equals(normalized)) {
                return known;
            }
        }
        return GraphNode.of(ownerId, NodeLabel.ENTITY, name);
    }
}
