package br.edu.ifba.journal.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.journal.llm.LLMFunction;

/**
 * Scriptable {@link LLMFunction} for tests.
 *
 * <p>Calls are told apart by their parameters: JSON mode is extraction, 150 output tokens is a
 * summary, 50 is a greeting, anything else is a reply. Replies are taken from a queue first and
 * from the handler of the call kind after that.</p>
 */
public class ScriptedLlm implements LLMFunction {

    public enum Kind {
        EXTRACTION, SUMMARY, GREETING, REPLY
    }

    public record Call(Kind kind, String prompt, String systemPrompt, List<Message> history, Map<String, Object> kwargs) {}

    private final Map<Kind, Function<String, String>> handlers = new EnumMap<>(Kind.class);
    private final Deque<String> queuedReplies = new ArrayDeque<>();
    private final List<Call> calls = new ArrayList<>();
    private final EnumMap<Kind, Boolean> failing = new EnumMap<>(Kind.class);

    public ScriptedLlm() {
        handlers.put(Kind.EXTRACTION, prompt -> "{\"entities\": [], \"emotions\": [], \"relationships\": [], \"intent\": \"general\"}");
        handlers.put(Kind.SUMMARY, prompt -> "The user talked about their day.");
        handlers.put(Kind.GREETING, prompt -> "Welcome back. How is the week going?");
        handlers.put(Kind.REPLY, prompt -> "I hear you. What feels heaviest about it?");
    }

    public ScriptedLlm on(Kind kind, Function<String, String> handler) {
        handlers.put(kind, handler);
        return this;
    }

    public ScriptedLlm respond(Kind kind, String answer) {
        return on(kind, prompt -> answer);
    }

    /**
     * Reply drafts served in order before the reply handler is used.
     */
    public ScriptedLlm queueReplies(String... replies) {
        synchronized (queuedReplies) {
            queuedReplies.addAll(List.of(replies));
        }
        return this;
    }

    public ScriptedLlm failing(Kind kind, boolean fail) {
        synchronized (failing) {
            failing.put(kind, fail);
        }
        return this;
    }

    public ScriptedLlm failingEverything() {
        for (Kind kind : Kind.values()) {
            failing(kind, true);
        }
        return this;
    }

    @Override
    public CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @Nullable List<Message> historyMessages,
        @NotNull Map<String, Object> kwargs
    ) {
        Kind kind = classify(kwargs);
        synchronized (calls) {
            calls.add(new Call(kind, prompt, systemPrompt, historyMessages == null ? List.of() : historyMessages, kwargs));
        }
        synchronized (failing) {
            if (failing.getOrDefault(kind, false)) {
                return CompletableFuture.failedFuture(new IllegalStateException("model unavailable"));
            }
        }
        if (kind == Kind.REPLY) {
            synchronized (queuedReplies) {
                if (!queuedReplies.isEmpty()) {
                    return CompletableFuture.completedFuture(queuedReplies.poll());
                }
            }
        }
        return CompletableFuture.completedFuture(handlers.get(kind).apply(prompt));
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public List<Call> calls(Kind kind) {
        return calls().stream().filter(call -> call.kind() == kind).toList();
    }

    private static Kind classify(Map<String, Object> kwargs) {
        if (kwargs.containsKey(RESPONSE_FORMAT)) {
            return Kind.EXTRACTION;
        }
        Object maxTokens = kwargs.get(MAX_TOKENS);
        if (Integer.valueOf(150).equals(maxTokens)) {
            return Kind.SUMMARY;
        }
        if (Integer.valueOf(50).equals(maxTokens)) {
            return Kind.GREETING;
        }
        return Kind.REPLY;
    }
}
