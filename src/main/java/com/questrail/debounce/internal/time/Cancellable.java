package com.questrail.debounce.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for a scheduled debounce delay, a value source
 * subscription, or a registered cancellation listener.
 *
 * <p>
 * The interface is kept tiny so it can be implemented by:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>a value source that stops delivering when cancelled</li>
 * </ul>
 * </p>
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * Attempt to cancel the handle's underlying work.
     *
     * @return {@code true} if this call prevented the work from running;
     *         {@code false} if it had already run or was previously cancelled.
     */
    boolean cancel();

    /**
     * Handle that has nothing left to cancel.
     */
    Cancellable NONE = () -> false;
}
