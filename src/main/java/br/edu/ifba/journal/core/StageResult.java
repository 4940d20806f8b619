package br.edu.ifba.journal.core;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one pipeline stage: a value, or an "unavailable" marker with the reason.
 *
 * <p>Degraded paths compose these explicitly instead of short-circuiting on exceptions.</p>
 *
 * @param <T> value type
 */
public final class StageResult<T> {

    private final T value;
    private final Duration elapsed;
    private final String failureReason;
    private final boolean skipped;

    private StageResult(@Nullable T value, @NotNull Duration elapsed,
                        @Nullable String failureReason, boolean skipped) {
        this.value = value;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed must not be null");
        this.failureReason = failureReason;
        this.skipped = skipped;
    }

    @NotNull
    public static <T> StageResult<T> available(@NotNull T value, @NotNull Duration elapsed) {
        return new StageResult<>(Objects.requireNonNull(value, "value must not be null"), elapsed, null, false);
    }

    @NotNull
    public static <T> StageResult<T> unavailable(@NotNull String reason, @NotNull Duration elapsed) {
        return new StageResult<>(null, elapsed, Objects.requireNonNull(reason, "reason must not be null"), false);
    }

    /**
     * A stage that did not run because its input was empty. Counts as unavailable.
     */
    @NotNull
    public static <T> StageResult<T> skipped(@NotNull String reason) {
        return new StageResult<>(null, Duration.ZERO, reason, true);
    }

    public boolean isAvailable() {
        return failureReason == null;
    }

    public boolean isSkipped() {
        return skipped;
    }

    /**
     * @throws IllegalStateException if the stage was unavailable
     */
    @NotNull
    public T value() {
        if (!isAvailable()) {
            throw new IllegalStateException("Stage result unavailable: " + failureReason);
        }
        return value;
    }

    @NotNull
    public T valueOr(@NotNull T fallback) {
        return isAvailable() ? value : fallback;
    }

    @NotNull
    public <R> StageResult<R> map(@NotNull Function<? super T, ? extends R> mapper) {
        if (!isAvailable()) {
            return new StageResult<>(null, elapsed, failureReason, skipped);
        }
        return new StageResult<>(mapper.apply(value), elapsed, null, false);
    }

    @NotNull
    public Duration elapsed() {
        return elapsed;
    }

    @Nullable
    public String failureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        if (isAvailable()) {
            return "StageResult{available, elapsed=" + elapsed.toMillis() + "ms}";
        }
        return "StageResult{" + (skipped ? "skipped" : "unavailable") + ", reason='" + failureReason
            + "', elapsed=" + elapsed.toMillis() + "ms}";
    }
}
