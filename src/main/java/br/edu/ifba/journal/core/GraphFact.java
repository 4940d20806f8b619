package br.edu.ifba.journal.core;

import java.util.Comparator;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * A relation found near a queried entity in the user's knowledge graph.
 *
 * @param anchor the queried entity name the walk started from
 * @param subject source node name of the edge
 * @param relation edge type, or its sub-type for {@code RELATES_TO} edges
 * @param object target node name of the edge
 * @param objectLabel label of the node on the far side of the walk
 * @param hops distance of the edge from the anchor, starting at 1
 */
public record GraphFact(
    @NotNull String anchor,
    @NotNull String subject,
    @NotNull String relation,
    @NotNull String object,
    @NotNull String objectLabel,
    int hops
) {

    /** Nearest first, then alphabetical by entity name ignoring case. */
    public static final Comparator<GraphFact> PRIORITY = Comparator
        .comparingInt(GraphFact::hops)
        .thenComparing(GraphFact::anchor, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(GraphFact::subject, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(GraphFact::object, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(GraphFact::relation);

    @NotNull
    public String describe() {
        return subject + " " + relation.toLowerCase(Locale.ROOT).replace('_', ' ') + " " + object;
    }
}
