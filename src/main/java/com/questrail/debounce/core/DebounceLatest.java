package com.questrail.debounce.core;

import com.questrail.debounce.cancel.CancellationScope;
import com.questrail.debounce.config.DebounceConfig;
import com.questrail.debounce.internal.time.Cancellable;
import com.questrail.debounce.internal.time.MonotonicClock;
import com.questrail.debounce.internal.time.MonotonicScheduler;
import com.questrail.debounce.internal.time.SystemWallClock;
import com.questrail.debounce.internal.time.WallClock;
import com.questrail.debounce.observability.DebounceErrorEvent;
import com.questrail.debounce.observability.DebounceObservabilitySink;
import com.questrail.debounce.observability.NullObservabilitySink;
import com.questrail.debounce.observability.TaskTransitionEvent;
import com.questrail.debounce.observability.ValueAcceptedEvent;
import com.questrail.debounce.source.ValueSink;
import com.questrail.debounce.source.ValueSource;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * DebounceLatest
 * =============================================================================
 * Latest-wins debounce operator: for each accepted value it schedules a
 * delayed action, and a newer value cancels whatever the previous value's task
 * was doing, whether waiting out its delay or running its action.
 *
 * <h2>Acceptance</h2>
 * <ol>
 *   <li>Cancel the current pending task, if it is not terminal yet.</li>
 *   <li>Create a task for the new value and arm its delay on the scheduler.
 *       The delay is never skipped, even for a zero timeout.</li>
 *   <li>Record the new task as current.</li>
 * </ol>
 * Acceptance steps are serialized, so two values are never accepted
 * concurrently and there is no instant with two uncancelled tasks. Operator
 * state itself sits behind a separate short-lived lock that is never held
 * while user code (action continuations, the observability sink) runs.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one action is running at a time. A task whose delay elapses
 *       while its predecessor is still unwinding waits for the predecessor to
 *       reach a terminal state, then re-checks cancellation before starting.</li>
 *   <li>An action is never invoked once its task has been cancelled.</li>
 *   <li>Cancellation is silent. Any other action failure terminates the whole
 *       pipeline and is delivered through {@link #completion()}.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   attach(source) / accept(v)  → values debounced
 *   complete()                  → source closed; completion once the last task is terminal
 *   cancel()                    → teardown; completion is cancelled
 *   action failure              → teardown; completion fails with the cause
 * </pre>
 *
 * @param <T> value type
 */
public final class DebounceLatest<T> implements ValueSink<T>
{
    private final Duration timeout;
    private final DebounceAction<T> action;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final DebounceObservabilitySink observabilitySink;

    private final CancellationScope scope;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    // Serializes acceptance steps. Held while user code runs; never taken under lock.
    private final Object acceptLock = new Object();
    private final Object lock = new Object();

    // Guarded by lock.
    private PendingTask<T> current;
    // Completes once every task created so far is terminal.
    private CompletableFuture<Void> quiescent = CompletableFuture.completedFuture(null);
    private long sequence = 0L;
    private boolean closed = false;
    private boolean attached = false;
    private Cancellable sourceHandle = Cancellable.NONE;

    private DebounceLatest(Builder<T> builder)
    {
        this.timeout = builder.config.timeout();
        this.action = Objects.requireNonNull(builder.action, "action");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.wallClock = Objects.requireNonNull(builder.wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(builder.observabilitySink, NullObservabilitySink.INSTANCE);

        CancellationScope enclosing = Objects.requireNonNullElseGet(builder.scope, () -> CancellationScope.root("debounce"));
        this.scope = enclosing.child("debounce-latest");
        this.scope.onCancel(this::onScopeCancelled);
    }

    /**
     * Attaches the operator to a source and debounces its values until the
     * source closes or the operator's scope is cancelled, whichever comes first.
     *
     * @param source    producer of values
     * @param timeout   delay an accepted value must survive before its action runs
     * @param action    side effect for the latest value
     * @param scheduler scheduler providing the cancellable delay
     * @param clock     monotonic clock the scheduler's deadlines are expressed in
     * @param scope     enclosing scope; cancelling it tears the pipeline down
     * @return the running operator
     */
    public static <T> DebounceLatest<T> debounceLatest(ValueSource<T> source,
                                                       Duration timeout,
                                                       DebounceAction<T> action,
                                                       MonotonicScheduler scheduler,
                                                       MonotonicClock clock,
                                                       CancellationScope scope)
    {
        return DebounceLatest.<T>builder()
                .withTimeout(timeout)
                .withAction(action)
                .withScheduler(scheduler)
                .withClock(clock)
                .withScope(scope)
                .build()
                .attach(source);
    }

    /**
     * Starts consuming {@code source}. May be called at most once.
     *
     * @return this operator
     */
    public DebounceLatest<T> attach(ValueSource<T> source)
    {
        Objects.requireNonNull(source, "source");

        synchronized (lock) {
            if (attached) {
                throw new IllegalStateException("DebounceLatest is already attached to a source");
            }
            attached = true;
            if (closed) {
                return this;
            }
        }

        Cancellable handle = source.open(this);

        boolean stopNow;
        synchronized (lock) {
            stopNow = closed;
            if (!stopNow) {
                sourceHandle = handle;
            }
        }
        if (stopNow) {
            // Closed, cancelled or failed while the source was opening.
            handle.cancel();
        }
        return this;
    }

    /**
     * Accepts the next value: supersedes the current task and schedules a new one.
     *
     * @return {@code false} if the pipeline no longer accepts values
     */
    public boolean accept(T value)
    {
        synchronized (acceptLock) {
            PendingTask<T> previous;
            synchronized (lock) {
                if (closed || scope.isCancelled()) {
                    return false;
                }
                previous = current;
            }

            // Runs the superseded task's cancellation listeners, and with them any
            // continuations of its action, so the state lock must not be held here.
            long superseded = 0L;
            if (previous != null && !previous.isTerminated()) {
                superseded = previous.sequence();
                previous.cancel();
            }

            PendingTask<T> task;
            CompletableFuture<Void> predecessor;
            synchronized (lock) {
                if (closed) {
                    // Torn down, or the superseded action failed while unwinding.
                    return false;
                }
                predecessor = quiescent;
                long seq = ++sequence;
                task = new PendingTask<>(seq, value, scope.child("task-" + seq), scheduler, clock, this::onTaskTransition);
                current = task;
                quiescent = predecessor.isDone()
                        ? task.terminationFuture().thenApply(outcome -> null)
                        : CompletableFuture.allOf(predecessor, task.terminationFuture());
            }

            observabilitySink.onValueAccepted(new ValueAcceptedEvent(wallClock.now(), task.sequence(), value, superseded));
            task.arm(timeout, () -> onDelayElapsed(task, predecessor));
            return true;
        }
    }

    @Override
    public boolean onValue(T value)
    {
        return accept(value);
    }

    @Override
    public void onClose()
    {
        complete();
    }

    @Override
    public void onError(Throwable cause)
    {
        fail("Value source failed", cause);
    }

    /**
     * Signals that no more values will arrive. The pending task, if any, is left
     * to finish; {@link #completion()} completes once it is terminal.
     */
    public void complete()
    {
        CompletableFuture<Void> drained;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            sourceHandle = Cancellable.NONE;
            drained = current == null ? quiescent : null;
        }
        if (drained != null) {
            drained.whenComplete((ignored, failure) -> finishNormally());
        }
    }

    /**
     * Tears the pipeline down: the current task is cancelled wherever it is,
     * the source is detached and no further values are accepted.
     *
     * @return {@code true} if this call performed the teardown
     */
    public boolean cancel()
    {
        return scope.cancel();
    }

    /**
     * Settles when the pipeline has finished:
     * <ul>
     *   <li>normally, after {@link #complete()} once every task is terminal;</li>
     *   <li>cancelled ({@link CompletableFuture#isCancelled()}), after teardown;</li>
     *   <li>exceptionally with the original cause, after an action or source failure.</li>
     * </ul>
     */
    public CompletableFuture<Void> completion()
    {
        return completion;
    }

    public Optional<PendingTask<T>> currentTask()
    {
        synchronized (lock) {
            return Optional.ofNullable(current);
        }
    }

    /**
     * Number of values accepted so far.
     */
    public long acceptedCount()
    {
        synchronized (lock) {
            return sequence;
        }
    }

    /**
     * {@code true} once the pipeline no longer accepts values.
     */
    public boolean isTerminated()
    {
        synchronized (lock) {
            return closed;
        }
    }

    public Duration timeout()
    {
        return timeout;
    }

    private void onDelayElapsed(PendingTask<T> task, CompletableFuture<Void> predecessor)
    {
        if (task.isCancelled()) {
            return;
        }
        if (predecessor.isDone()) {
            startAction(task);
        }
        else {
            // An earlier action is still unwinding; keep at most one running.
            predecessor.whenComplete((outcome, failure) -> startAction(task));
        }
    }

    private void startAction(PendingTask<T> task)
    {
        if (!task.markRunning()) {
            return;
        }
        if (task.isCancelled()) {
            // Cancelled between the state change and the call: never invoke.
            task.settle(TaskOutcome.CANCELLED);
            return;
        }

        CompletionStage<?> stage;
        try {
            stage = action.run(task.value(), task);
        }
        catch (Throwable t) {
            task.settle(classify(task, t));
            return;
        }

        if (stage == null) {
            task.settle(classify(task, null));
            return;
        }
        stage.whenComplete((result, failure) -> task.settle(classify(task, failure)));
    }

    private static TaskOutcome classify(PendingTask<?> task, Throwable failure)
    {
        Throwable cause = unwrap(failure);
        if (cause == null) {
            return task.isCancelled() ? TaskOutcome.CANCELLED : TaskOutcome.COMPLETED;
        }
        if (cause instanceof CancellationException) {
            return TaskOutcome.CANCELLED;
        }
        return TaskOutcome.failed(cause);
    }

    private static Throwable unwrap(Throwable failure)
    {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private void onTaskTransition(PendingTask<T> task, TaskState from, TaskState to, TaskOutcome outcome)
    {
        observabilitySink.onTaskTransition(new TaskTransitionEvent(
                wallClock.now(),
                task.sequence(),
                from,
                to,
                Optional.ofNullable(outcome)
        ));

        if (!to.isTerminal()) {
            return;
        }

        if (outcome instanceof TaskOutcome.Failed failed) {
            fail("Action failed for debounce task #" + task.sequence(), failed.cause());
            return;
        }

        CompletableFuture<Void> drained = null;
        synchronized (lock) {
            if (current == task) {
                current = null;
                if (closed) {
                    drained = quiescent;
                }
            }
        }
        if (drained != null) {
            // Also waits for superseded actions that are still unwinding.
            drained.whenComplete((ignored, failure) -> finishNormally());
        }
    }

    private void fail(String message, Throwable cause)
    {
        boolean first = completion.completeExceptionally(cause);
        synchronized (lock) {
            closed = true;
            current = null;
        }
        if (first) {
            observabilitySink.onError(new DebounceErrorEvent(wallClock.now(), message, cause));
        }
        // Stops the source and cancels whatever else is still pending.
        scope.cancel();
    }

    private void finishNormally()
    {
        if (completion.complete(null)) {
            scope.detach();
        }
    }

    private void onScopeCancelled()
    {
        Cancellable source;
        synchronized (lock) {
            closed = true;
            source = sourceHandle;
            sourceHandle = Cancellable.NONE;
        }
        source.cancel();
        // No-op if the pipeline already failed or completed.
        completion.cancel(false);
    }

    public static <T> Builder<T> builder()
    {
        return new Builder<>();
    }

    public static final class Builder<T>
    {
        private DebounceConfig config = DebounceConfig.defaults();
        private DebounceAction<T> action;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private CancellationScope scope;
        private DebounceObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder<T> withConfig(DebounceConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder<T> withTimeout(Duration timeout)
        {
            this.config = new DebounceConfig(timeout);
            return this;
        }

        public Builder<T> withTimeoutMillis(long timeoutMillis)
        {
            this.config = DebounceConfig.ofMillis(timeoutMillis);
            return this;
        }

        public Builder<T> withAction(DebounceAction<T> action)
        {
            this.action = action;
            return this;
        }

        public Builder<T> withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder<T> withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder<T> withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder<T> withScope(CancellationScope scope)
        {
            this.scope = scope;
            return this;
        }

        public Builder<T> withObservabilitySink(DebounceObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public DebounceLatest<T> build()
        {
            return new DebounceLatest<>(this);
        }
    }
}
