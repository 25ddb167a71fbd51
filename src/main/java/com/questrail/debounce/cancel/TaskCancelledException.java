package com.questrail.debounce.cancel;

import java.util.concurrent.CancellationException;

/**
 * TaskCancelledException
 * =============================================================================
 * The cancellation signal raised at a suspension point when the surrounding
 * {@link CancellationScope} has been cancelled.
 *
 * <p>This is an <em>expected</em> signal, not a failure. It is raised when a
 * pending debounce task is superseded by a newer value, or when the enclosing
 * pipeline is torn down. It propagates through the task's own unwind path and
 * is absorbed at the task boundary; it is never reported as an error.</p>
 *
 * <p>Extending {@link CancellationException} keeps the signal recognisable to
 * {@code CompletableFuture} and to callers that already handle the JDK type.</p>
 */
public class TaskCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message description of which scope was cancelled
     */
    public TaskCancelledException(String message) {
        super(message);
    }
}
