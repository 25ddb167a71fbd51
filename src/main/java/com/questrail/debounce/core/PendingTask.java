package com.questrail.debounce.core;

import com.questrail.debounce.cancel.CancellationScope;
import com.questrail.debounce.cancel.TaskCancelledException;
import com.questrail.debounce.internal.time.Cancellable;
import com.questrail.debounce.internal.time.MonotonicClock;
import com.questrail.debounce.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PendingTask
 * =============================================================================
 * The operator's single-slot record of deferred work for one accepted value.
 *
 * <h2>Ownership</h2>
 * A task is created by {@link DebounceLatest} when a value is accepted and is
 * only ever cancelled by the operator (superseding value) or through its
 * scope's parent (pipeline teardown). Once terminal it is discarded; tasks are
 * never reused.
 *
 * <h2>Thread Safety</h2>
 * State changes are compare-and-set, so each transition happens exactly once
 * even when cancellation races with the delay elapsing or the action settling.
 */
public final class PendingTask<T> implements TaskContext
{
    /**
     * Receives every successful state change, after it has been applied.
     */
    @FunctionalInterface
    interface TransitionListener<T>
    {
        void onTransition(PendingTask<T> task, TaskState from, TaskState to, TaskOutcome outcome);
    }

    private final long sequence;
    private final T value;
    private final CancellationScope scope;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final TransitionListener<T> listener;

    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.SCHEDULED);
    private final CompletableFuture<TaskOutcome> termination = new CompletableFuture<>();
    private volatile Cancellable delayHandle = Cancellable.NONE;

    PendingTask(long sequence,
                T value,
                CancellationScope scope,
                MonotonicScheduler scheduler,
                MonotonicClock clock,
                TransitionListener<T> listener)
    {
        this.sequence = sequence;
        this.value = value;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Starts the debounce delay. {@code onElapsed} runs on the scheduler once the
     * delay has passed, unless the task was cancelled first.
     */
    void arm(Duration timeout, Runnable onElapsed)
    {
        delayHandle = scheduler.scheduleAfter(timeout, clock, onElapsed);
        scope.onCancel(this::onScopeCancelled);
    }

    /**
     * Moves a scheduled task to {@link TaskState#RUNNING}.
     *
     * @return {@code false} if the task was cancelled before it could start
     */
    boolean markRunning()
    {
        if (scope.isCancelled() || !state.compareAndSet(TaskState.SCHEDULED, TaskState.RUNNING)) {
            return false;
        }
        listener.onTransition(this, TaskState.SCHEDULED, TaskState.RUNNING, null);
        return true;
    }

    /**
     * Records how the running action settled.
     */
    boolean settle(TaskOutcome outcome)
    {
        return finish(TaskState.RUNNING, outcome);
    }

    /**
     * Requests cancellation. A scheduled task finishes immediately; a running
     * one finishes when its action next yields or settles.
     */
    void cancel()
    {
        scope.cancel();
    }

    private void onScopeCancelled()
    {
        delayHandle.cancel();
        finish(TaskState.SCHEDULED, TaskOutcome.CANCELLED);
    }

    private boolean finish(TaskState expected, TaskOutcome outcome)
    {
        if (!state.compareAndSet(expected, outcome.state())) {
            return false;
        }
        scope.detach();
        listener.onTransition(this, expected, outcome.state(), outcome);
        termination.complete(outcome);
        return true;
    }

    public long sequence()
    {
        return sequence;
    }

    public T value()
    {
        return value;
    }

    public TaskState state()
    {
        return state.get();
    }

    /**
     * Completes with the task's outcome once it reaches a terminal state.
     */
    public CompletionStage<TaskOutcome> termination()
    {
        return termination.minimalCompletionStage();
    }

    CompletableFuture<TaskOutcome> terminationFuture()
    {
        return termination;
    }

    boolean isTerminated()
    {
        return termination.isDone();
    }

    @Override
    public boolean isCancelled()
    {
        return scope.isCancelled();
    }

    @Override
    public void throwIfCancelled()
    {
        scope.throwIfCancelled();
    }

    @Override
    public CompletionStage<Void> delay(Duration duration)
    {
        Objects.requireNonNull(duration, "duration");

        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        if (scope.isCancelled()) {
            elapsed.completeExceptionally(cancellationSignal());
            return elapsed;
        }

        Cancellable timer = scheduler.scheduleAfter(duration, clock, () -> elapsed.complete(null));
        Cancellable registration = scope.onCancel(() -> {
            timer.cancel();
            elapsed.completeExceptionally(cancellationSignal());
        });
        elapsed.whenComplete((ignored, failure) -> registration.cancel());
        return elapsed;
    }

    @Override
    public CancellationScope scope()
    {
        return scope;
    }

    private TaskCancelledException cancellationSignal()
    {
        return new TaskCancelledException("debounce task #" + sequence + " was cancelled");
    }

    @Override
    public String toString()
    {
        return "PendingTask[#" + sequence + ", " + state.get() + "]";
    }
}
