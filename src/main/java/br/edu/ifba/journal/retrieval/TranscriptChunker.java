package br.edu.ifba.journal.retrieval;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.utils.TokenUtil;

/**
 * Slices an entry into the texts that get embedded.
 *
 * <p>The summary is split by token count first, then every user turn is paired with the reply
 * that followed it ({@code "User: ...\nAssistant: ..."}). Slice order is stable, so the slice
 * index can be part of the chunk id.</p>
 */
public class TranscriptChunker {

    private final int maxTokens;

    public TranscriptChunker(int maxTokens) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    @NotNull
    public List<String> chunk(@NotNull Entry entry) {
        List<String> slices = new ArrayList<>();
        if (!entry.summary().isBlank()) {
            slices.addAll(TokenUtil.chunkText(entry.summary(), maxTokens));
        }

        List<Turn> transcript = entry.transcript();
        for (int i = 0; i < transcript.size(); i++) {
            Turn turn = transcript.get(i);
            if (turn.speaker() != Turn.Speaker.USER || turn.content().isBlank()) {
                continue;
            }
            String pair = turn.transcriptLine();
            if (i + 1 < transcript.size() && transcript.get(i + 1).speaker() == Turn.Speaker.ASSISTANT) {
                pair = pair + "\n" + transcript.get(i + 1).transcriptLine();
            }
            slices.add(TokenUtil.truncateToTokenLimit(pair, maxTokens));
        }
        return slices;
    }
}
