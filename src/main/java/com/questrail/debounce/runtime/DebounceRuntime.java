package com.questrail.debounce.runtime;

import com.questrail.debounce.cancel.CancellationScope;
import com.questrail.debounce.config.DebounceRuntimeConfig;
import com.questrail.debounce.core.DebounceAction;
import com.questrail.debounce.core.DebounceLatest;
import com.questrail.debounce.internal.time.MonotonicClock;
import com.questrail.debounce.internal.time.MonotonicScheduler;
import com.questrail.debounce.internal.time.ScheduledExecutorScheduler;
import com.questrail.debounce.internal.time.SystemMonotonicClock;
import com.questrail.debounce.observability.DebounceObservabilitySink;
import com.questrail.debounce.observability.Slf4jDebounceObservabilitySink;
import com.questrail.debounce.source.ValueSource;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DebounceRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a real-time debounce pipeline:
 * a scheduler thread pool on the system monotonic clock, the operator, and
 * the source it consumes.
 *
 * <pre>
 *   runtime.start()  → attaches the source; values start being debounced
 *   runtime.stop()   → cancels the pipeline and shuts the scheduler down
 * </pre>
 */
public final class DebounceRuntime<T> {
    private final DebounceLatest<T> operator;
    private final ValueSource<T> source;
    private final ScheduledExecutorService schedulerExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private DebounceRuntime(DebounceLatest<T> operator,
                            ValueSource<T> source,
                            ScheduledExecutorService schedulerExecutor) {
        this.operator = operator;
        this.source = source;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("DebounceRuntime already started");
        }
        operator.attach(source);
    }

    public void stop() {
        operator.cancel();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public CompletableFuture<Void> completion() {
        return operator.completion();
    }

    public DebounceLatest<T> operator() {
        return operator;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static final class Builder<T> {
        private DebounceRuntimeConfig config = DebounceRuntimeConfig.builder().build();
        private ValueSource<T> source;
        private DebounceAction<T> action;
        private CancellationScope scope;
        private DebounceObservabilitySink observabilitySink = new Slf4jDebounceObservabilitySink();

        public Builder<T> withConfig(DebounceRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder<T> withSource(ValueSource<T> source) {
            this.source = source;
            return this;
        }

        public Builder<T> withAction(DebounceAction<T> action) {
            this.action = action;
            return this;
        }

        public Builder<T> withScope(CancellationScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder<T> withObservabilitySink(DebounceObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public DebounceRuntime<T> build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(action, "action");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                    Executors.newScheduledThreadPool(config.schedulerThreads(), new SchedulerThreadFactory());
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            DebounceLatest<T> operator = DebounceLatest.<T>builder()
                    .withConfig(config.debounce())
                    .withAction(action)
                    .withScheduler(scheduler)
                    .withClock(clock)
                    .withScope(scope)
                    .withObservabilitySink(observabilitySink)
                    .build();

            return new DebounceRuntime<>(operator, source, schedulerExec);
        }
    }

    private static final class SchedulerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "debounce-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
