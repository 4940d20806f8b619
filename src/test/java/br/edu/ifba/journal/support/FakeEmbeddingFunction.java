package br.edu.ifba.journal.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.embedding.EmbeddingFunction;

/**
 * Deterministic bag-of-words embedding for tests.
 *
 * <p>Each lower-cased word is hashed into one of {@value #DIMENSIONS} buckets and the vector is
 * normalised, so texts sharing words are similar and identical texts score 1.0.</p>
 */
public class FakeEmbeddingFunction implements EmbeddingFunction {

    public static final int DIMENSIONS = 64;

    private final String version;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean failing;

    public FakeEmbeddingFunction() {
        this("fake-v1");
    }

    public FakeEmbeddingFunction(String version) {
        this.version = version;
    }

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull List<String> texts) {
        calls.incrementAndGet();
        if (failing) {
            return CompletableFuture.failedFuture(new IllegalStateException("embedding service down"));
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorOf(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    @Override
    @NotNull
    public String modelVersion() {
        return version;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int getCalls() {
        return calls.get();
    }

    public static float[] vectorOf(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!word.isEmpty()) {
                vector[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1f;
            }
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            vector[0] = 1f;
            return vector;
        }
        float length = (float) Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= length;
        }
        return vector;
    }
}
