package com.questrail.debounce.source;

import com.questrail.debounce.internal.time.Cancellable;

/**
 * ValueSource
 * -----------------------------------------------------------------------------
 * Minimal port for a producer of values over time (timer, queue, network
 * listener).
 *
 * <p>The consumer never closes the source itself. When it stops consuming it
 * cancels the handle returned by {@link #open(ValueSink)}, after which the
 * source must stop delivering to that sink.</p>
 */
@FunctionalInterface
public interface ValueSource<T>
{
    /**
     * Starts delivering values to the given sink.
     *
     * <p>Delivery may begin before this method returns, on the calling thread
     * or on a thread owned by the source.</p>
     *
     * @return handle that stops delivery to {@code sink}
     */
    Cancellable open(ValueSink<T> sink);
}
