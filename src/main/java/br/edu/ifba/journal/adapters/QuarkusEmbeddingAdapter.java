package br.edu.ifba.journal.adapters;

import br.edu.ifba.journal.client.EmbeddingRequest;
import br.edu.ifba.journal.client.EmbeddingResponse;
import br.edu.ifba.journal.embedding.EmbeddingFunction;
import br.edu.ifba.journal.exception.DependencyUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Bridges the embedding endpoint to {@link EmbeddingFunction}. The configured model name is the
 * embedding version stored with every chunk.
 */
@ApplicationScoped
public class QuarkusEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusEmbeddingAdapter.class);

    @Inject
    LlmGateway gateway;

    @ConfigProperty(name = "embedding.model")
    String embeddingModel;

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        LOG.debugf("Embedding request - texts: %d, model: %s", texts.size(), embeddingModel);
        return gateway.embed(new EmbeddingRequest(embeddingModel, texts))
            .thenApply(response -> toVectors(response, texts.size()));
    }

    @NotNull
    @Override
    public String modelVersion() {
        return embeddingModel;
    }

    private List<float[]> toVectors(final EmbeddingResponse response, final int expected) {
        if (response.data() == null || response.data().size() != expected) {
            throw new DependencyUnavailableException("embedding", String.format(
                "Embedding API returned %d vectors for %d texts",
                response.data() == null ? 0 : response.data().size(), expected));
        }

        final List<EmbeddingResponse.Embedding> ordered = new ArrayList<>(response.data());
        ordered.sort(Comparator.comparing(e -> e.index() == null ? 0 : e.index()));

        final List<float[]> vectors = new ArrayList<>(ordered.size());
        for (final EmbeddingResponse.Embedding embedding : ordered) {
            final List<Double> values = embedding.embedding();
            if (values == null || values.isEmpty()) {
                throw new DependencyUnavailableException("embedding", "Embedding API returned an empty vector");
            }
            final float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }
        LOG.debugf("Embedded %d texts with dimension %d", vectors.size(), vectors.get(0).length);
        return vectors;
    }
}
