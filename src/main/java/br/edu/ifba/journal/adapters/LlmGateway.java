package br.edu.ifba.journal.adapters;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.quarkus.arc.Arc;
import io.quarkus.arc.ManagedContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import br.edu.ifba.journal.client.EmbeddingRequest;
import br.edu.ifba.journal.client.EmbeddingResponse;
import br.edu.ifba.journal.client.LlmChatClient;
import br.edu.ifba.journal.client.LlmChatRequest;
import br.edu.ifba.journal.client.LlmChatResponse;
import br.edu.ifba.journal.client.LlmEmbeddingClient;

/**
 * Guards the two model endpoints with a time limit and a circuit breaker each.
 *
 * <p>Blocking REST client calls run on a bounded pool whose threads carry the Quarkus class
 * loader. A call that exceeds its time limit fails its future but is left to finish; its result
 * is discarded. While the chat circuit is open, calls fail immediately and
 * {@link #isChatAvailable()} reports false, which sends extraction to the lexical tagger.</p>
 */
@ApplicationScoped
public class LlmGateway {

    private static final Logger LOG = Logger.getLogger(LlmGateway.class);
    private static final ClassLoader QUARKUS_CLASSLOADER = LlmGateway.class.getClassLoader();

    public static final String CHAT_CIRCUIT = "llm-chat";
    public static final String EMBEDDING_CIRCUIT = "llm-embedding";

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @ConfigProperty(name = "llm.pool-size", defaultValue = "8")
    int poolSize;

    @ConfigProperty(name = "llm.chat.timeout-ms", defaultValue = "30000")
    long chatTimeoutMs;

    @ConfigProperty(name = "llm.embedding.timeout-ms", defaultValue = "10000")
    long embeddingTimeoutMs;

    @ConfigProperty(name = "llm.circuit-breaker.failure-rate", defaultValue = "50")
    float failureRateThreshold;

    @ConfigProperty(name = "llm.circuit-breaker.window-size", defaultValue = "10")
    int slidingWindowSize;

    @ConfigProperty(name = "llm.circuit-breaker.open-ms", defaultValue = "30000")
    long waitInOpenStateMs;

    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private CircuitBreaker chatCircuit;
    private CircuitBreaker embeddingCircuit;
    private TimeLimiter chatLimiter;
    private TimeLimiter embeddingLimiter;

    @PostConstruct
    void init() {
        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory threadFactory = task -> {
            final Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
                task.run();
            }, "llm-gateway-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(poolSize, threadFactory);
        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);

        chatCircuit = circuit(CHAT_CIRCUIT);
        embeddingCircuit = circuit(EMBEDDING_CIRCUIT);
        chatLimiter = limiter(chatTimeoutMs);
        embeddingLimiter = limiter(embeddingTimeoutMs);

        LOG.infof("LLM gateway ready: pool=%d, chat timeout=%dms, embedding timeout=%dms, failure rate=%.0f%%",
            poolSize, chatTimeoutMs, embeddingTimeoutMs, failureRateThreshold);
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public CompletableFuture<LlmChatResponse> chat(final LlmChatRequest request) {
        return guarded(chatCircuit, chatLimiter, () -> chatClient.chat(request));
    }

    public CompletableFuture<EmbeddingResponse> embed(final EmbeddingRequest request) {
        return guarded(embeddingCircuit, embeddingLimiter, () -> embeddingClient.embed(request));
    }

    /**
     * @return false while the chat circuit is open
     */
    public boolean isChatAvailable() {
        return chatCircuit.getState() != CircuitBreaker.State.OPEN
            && chatCircuit.getState() != CircuitBreaker.State.FORCED_OPEN;
    }

    public CircuitBreaker.State chatState() {
        return chatCircuit.getState();
    }

    public CircuitBreaker.State embeddingState() {
        return embeddingCircuit.getState();
    }

    private <T> CompletableFuture<T> guarded(
            final CircuitBreaker circuit,
            final TimeLimiter limiter,
            final Supplier<T> call) {
        final Supplier<CompletionStage<T>> async = () -> CompletableFuture.supplyAsync(() -> inRequestContext(call), executor);
        final Supplier<CompletionStage<T>> timed = () -> limiter.executeCompletionStage(scheduler, async);
        return CircuitBreaker.decorateCompletionStage(circuit, timed).get().toCompletableFuture();
    }

    private static <T> T inRequestContext(final Supplier<T> call) {
        final ManagedContext requestContext = Arc.container().requestContext();
        final boolean activated = !requestContext.isActive();
        if (activated) {
            requestContext.activate();
        }
        try {
            return call.get();
        } finally {
            if (activated) {
                requestContext.deactivate();
            }
        }
    }

    private CircuitBreaker circuit(final String name) {
        final CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(failureRateThreshold)
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(slidingWindowSize)
            .minimumNumberOfCalls(Math.min(slidingWindowSize, 4))
            .waitDurationInOpenState(Duration.ofMillis(waitInOpenStateMs))
            .build();
        final CircuitBreaker circuit = CircuitBreaker.of(name, config);
        circuit.getEventPublisher().onStateTransition(event ->
            LOG.warnf("Circuit %s: %s", name, event.getStateTransition()));
        return circuit;
    }

    private static TimeLimiter limiter(final long timeoutMs) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(timeoutMs))
            .cancelRunningFuture(false)
            .build());
    }
}
