package br.edu.ifba.journal.adapters;

import br.edu.ifba.journal.client.ChatMessage;
import br.edu.ifba.journal.client.LlmChatRequest;
import br.edu.ifba.journal.exception.DependencyUnavailableException;
import br.edu.ifba.journal.llm.LLMFunction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bridges the chat completion endpoint to {@link LLMFunction}.
 * Message order: [system], [history...], [user prompt].
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);

    @Inject
    LlmGateway gateway;

    @ConfigProperty(name = "chat.model")
    String defaultModel;

    @ConfigProperty(name = "chat.temperature", defaultValue = "0.7")
    Double defaultTemperature;

    @ConfigProperty(name = "chat.max.tokens", defaultValue = "512")
    Integer defaultMaxTokens;

    @Override
    public CompletableFuture<String> apply(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @Nullable final List<Message> historyMessages,
            @NotNull final Map<String, Object> kwargs) {

        final List<ChatMessage> messages = buildMessages(prompt, systemPrompt, historyMessages);
        final String model = (String) kwargs.getOrDefault("model", defaultModel);
        final Double temperature = getDoubleParam(kwargs, TEMPERATURE, defaultTemperature);
        final Integer maxTokens = getIntegerParam(kwargs, MAX_TOKENS, defaultMaxTokens);
        final boolean json = "json".equals(kwargs.get(RESPONSE_FORMAT));

        LOG.debugf("Chat request - model: %s, messages: %d, maxTokens: %d, json: %s",
            model, messages.size(), maxTokens, json);

        return gateway.chat(LlmChatRequest.of(model, messages, maxTokens, temperature, json))
            .thenApply(response -> {
                final String content = response.firstContent();
                if (content == null) {
                    throw new DependencyUnavailableException("generation", "Chat model returned no choices");
                }
                final String tokenInfo = response.usage() != null ? String.valueOf(response.usage().totalTokens()) : "unknown";
                LOG.debugf("Chat response - length: %d characters, tokens: %s", content.length(), tokenInfo);
                return content;
            });
    }

    /**
     * Whether the chat model is currently worth calling.
     */
    public boolean isAvailable() {
        return gateway.isChatAvailable();
    }

    private List<ChatMessage> buildMessages(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @Nullable final List<Message> historyMessages) {

        final List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        if (historyMessages != null) {
            for (final Message msg : historyMessages) {
                messages.add(new ChatMessage(convertRole(msg.role()), msg.content()));
            }
        }
        messages.add(ChatMessage.user(prompt));
        return messages;
    }

    private String convertRole(@NotNull final Message.Role role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private Double getDoubleParam(final Map<String, Object> kwargs, final String key, final Double defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return defaultValue;
    }

    private Integer getIntegerParam(final Map<String, Object> kwargs, final String key, final Integer defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }
}
