package com.questrail.debounce.core;

import com.questrail.debounce.cancel.CancellationScope;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * TaskContext
 * -----------------------------------------------------------------------------
 * The running action's view of its own pending task.
 *
 * <p>Actions that take time should yield through {@link #delay(Duration)} or
 * check {@link #throwIfCancelled()} between steps. Those are the points where a
 * superseded action stops; code between them is never preempted.</p>
 */
public interface TaskContext
{
    /**
     * Sequence number of the task, starting at 1 for the first accepted value.
     */
    long sequence();

    boolean isCancelled();

    /**
     * @throws com.questrail.debounce.cancel.TaskCancelledException if the task has been cancelled
     */
    void throwIfCancelled();

    /**
     * Cancellable suspension point.
     *
     * <p>The returned stage completes normally once {@code duration} has elapsed
     * on the operator's clock, or exceptionally with
     * {@link com.questrail.debounce.cancel.TaskCancelledException} as soon as
     * the task is cancelled.</p>
     */
    CompletionStage<Void> delay(Duration duration);

    /**
     * The task's cancellation scope, for handing to nested work.
     */
    CancellationScope scope();
}
