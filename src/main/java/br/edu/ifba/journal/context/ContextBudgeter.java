package br.edu.ifba.journal.context;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.GraphFact;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.utils.TokenUtil;

/**
 * Fits the three knowledge sources of a turn into one token budget.
 *
 * <h2>Priority</h2>
 * <ol>
 *   <li>The reading of the current message, always kept whole even past the budget</li>
 *   <li>Past-entry snippets, most similar first (newer first on ties)</li>
 *   <li>Graph facts, fewest hops first, then by entity name</li>
 * </ol>
 *
 * <p>Items are taken in that order while they fit. The first item that does not fit is dropped
 * together with everything after it, so a tighter budget always drops a suffix of the priority
 * order. Items are never cut in half. The budget applies to the rendered block, so section
 * headers and the footer of past entries count against it once their section is present.
 * Token counts are cl100k_base counts (see {@link TokenUtil}).</p>
 */
public class ContextBudgeter {

    private static final Logger logger = LoggerFactory.getLogger(ContextBudgeter.class);

    @NotNull
    public ContextBlock assemble(
        @NotNull List<ScoredChunk> semantic,
        @NotNull List<GraphFact> graph,
        @NotNull ExtractedFact currentFacts,
        int maxTokens
    ) {
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must not be negative, got " + maxTokens);
        }

        List<ContextItem> included = new ArrayList<>();
        List<ContextItem> dropped = new ArrayList<>();

        String reading = ContextFormatter.currentReading(currentFacts);
        if (!reading.isEmpty()) {
            included.add(ContextItem.current(reading, TokenUtil.estimateTokens(reading)));
        }
        int used = renderedTokens(included);

        boolean overflowed = false;
        for (ContextItem item : candidates(semantic, graph)) {
            if (!overflowed) {
                included.add(item);
                int withItem = renderedTokens(included);
                if (withItem <= maxTokens) {
                    used = withItem;
                    continue;
                }
                included.remove(included.size() - 1);
                overflowed = true;
            }
            dropped.add(item);
        }

        if (!dropped.isEmpty()) {
            logger.debug("Context budget {} reached at {} tokens, dropped {} items (first dropped: {} {})",
                maxTokens, used, dropped.size(), dropped.get(0).kind(), dropped.get(0).sourceId());
        }

        return new ContextBlock(included, dropped, used, maxTokens, ContextFormatter.render(included));
    }

    private static int renderedTokens(List<ContextItem> items) {
        return TokenUtil.estimateTokens(ContextFormatter.render(items));
    }

    private List<ContextItem> candidates(List<ScoredChunk> semantic, List<GraphFact> graph) {
        List<ScoredChunk> rankedChunks = new ArrayList<>(semantic);
        rankedChunks.sort(ScoredChunk.RANKING);

        List<GraphFact> rankedFacts = new ArrayList<>(graph);
        rankedFacts.sort(GraphFact.PRIORITY);

        List<ContextItem> items = new ArrayList<>(rankedChunks.size() + rankedFacts.size());
        for (ScoredChunk scored : rankedChunks) {
            String line = ContextFormatter.semanticLine(scored);
            items.add(ContextItem.semantic(scored.chunk().id().toString(), line, TokenUtil.estimateTokens(line)));
        }
        for (GraphFact fact : rankedFacts) {
            String line = ContextFormatter.graphLine(fact);
            String key = fact.subject() + "|" + fact.relation() + "|" + fact.object();
            items.add(ContextItem.graph(key, line, TokenUtil.estimateTokens(line)));
        }
        return items;
    }
}
