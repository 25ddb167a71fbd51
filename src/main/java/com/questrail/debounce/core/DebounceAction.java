package com.questrail.debounce.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * DebounceAction
 * -----------------------------------------------------------------------------
 * The side effect run for the latest value once its debounce window elapses.
 *
 * <p>The action may finish synchronously (return a completed stage) or keep
 * running asynchronously and settle the returned stage later. A stage that
 * fails with a {@link java.util.concurrent.CancellationException} is treated
 * as a cancellation; any other failure, thrown or returned, terminates the
 * pipeline.</p>
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface DebounceAction<T>
{
    /**
     * @param value   the value this task was created for
     * @param context cancellation and suspension facilities for this task
     * @return stage that settles when the action is finished; {@code null} is
     *         treated as already completed
     */
    CompletionStage<?> run(T value, TaskContext context) throws Exception;

    /**
     * Adapts a synchronous procedure. It has no suspension points, so once
     * started it always runs to completion.
     */
    static <T> DebounceAction<T> of(Consumer<? super T> procedure)
    {
        Objects.requireNonNull(procedure, "procedure");
        return (value, context) -> {
            procedure.accept(value);
            return CompletableFuture.completedFuture(null);
        };
    }
}
