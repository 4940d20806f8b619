package br.edu.ifba.journal.context;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * The context handed to generation for one turn.
 *
 * @param included items kept, in priority order
 * @param dropped items removed to meet the budget, in priority order
 * @param totalTokens tokens of the rendered text
 * @param maxTokens the budget that was applied
 * @param text rendered context, empty when nothing was included
 */
public record ContextBlock(
    @NotNull List<ContextItem> included,
    @NotNull List<ContextItem> dropped,
    int totalTokens,
    int maxTokens,
    @NotNull String text
) {

    public ContextBlock {
        included = List.copyOf(included);
        dropped = List.copyOf(dropped);
    }

    public static ContextBlock empty(int maxTokens) {
        return new ContextBlock(List.of(), List.of(), 0, maxTokens, "");
    }

    public boolean isEmpty() {
        return included.isEmpty();
    }

    public boolean hasSemantic() {
        return included.stream().anyMatch(ContextItem::isSemantic);
    }

    @NotNull
    public List<ContextItem> itemsOf(@NotNull ContextItem.Kind kind) {
        return included.stream().filter(item -> item.kind() == kind).toList();
    }
}
