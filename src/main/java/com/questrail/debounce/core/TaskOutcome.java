package com.questrail.debounce.core;

import java.util.Objects;

/**
 * TaskOutcome
 * -----------------------------------------------------------------------------
 * Tagged result of a finished {@link PendingTask}.
 *
 * <p>The operator branches on the variant rather than on exception types:
 * {@link Cancelled} is silent and expected, {@link Failed} terminates the
 * pipeline.</p>
 */
public sealed interface TaskOutcome
        permits TaskOutcome.Completed, TaskOutcome.Cancelled, TaskOutcome.Failed
{
    Completed COMPLETED = new Completed();
    Cancelled CANCELLED = new Cancelled();

    /**
     * The terminal {@link TaskState} this outcome corresponds to.
     */
    TaskState state();

    static Failed failed(Throwable cause)
    {
        return new Failed(cause);
    }

    record Completed() implements TaskOutcome {
        @Override
        public TaskState state() {
            return TaskState.COMPLETED;
        }
    }

    record Cancelled() implements TaskOutcome {
        @Override
        public TaskState state() {
            return TaskState.CANCELLED;
        }
    }

    record Failed(Throwable cause) implements TaskOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public TaskState state() {
            return TaskState.FAILED;
        }
    }
}
