package com.questrail.debounce.source;

import com.questrail.debounce.internal.time.Cancellable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * QueueValueSource
 * =============================================================================
 * {@link ValueSource} that drains a {@link BlockingQueue} on a dedicated thread.
 *
 * <h2>Threading Model</h2>
 * A single reader thread takes values in queue order and hands them to the
 * sink one at a time, so sink callbacks are serialized.
 *
 * <h2>End of stream</h2>
 * Offering the configured end-of-stream marker closes the sink and ends the
 * reader thread. Cancelling the handle returned by {@link #open(ValueSink)}
 * stops the reader without closing the sink.
 */
public final class QueueValueSource<T> implements ValueSource<T>
{
    private static final Logger log = LoggerFactory.getLogger(QueueValueSource.class);

    private final BlockingQueue<T> queue;
    private final T endOfStream;
    private final String threadName;
    private final AtomicBoolean opened = new AtomicBoolean(false);

    /**
     * @param queue       queue drained by the reader thread
     * @param endOfStream marker value that closes the sink; compared by identity
     * @param threadName  name of the reader thread
     */
    public QueueValueSource(BlockingQueue<T> queue, T endOfStream, String threadName)
    {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.endOfStream = Objects.requireNonNull(endOfStream, "endOfStream");
        this.threadName = Objects.requireNonNull(threadName, "threadName");
    }

    @Override
    public Cancellable open(ValueSink<T> sink)
    {
        Objects.requireNonNull(sink, "sink");
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("QueueValueSource can only be opened once");
        }

        Reader reader = new Reader(sink);
        Thread thread = new Thread(reader, threadName);
        thread.setDaemon(true);
        reader.thread = thread;
        thread.start();
        return reader;
    }

    private final class Reader implements Runnable, Cancellable
    {
        private final ValueSink<T> sink;
        private final AtomicBoolean running = new AtomicBoolean(true);
        private volatile Thread thread;

        private Reader(ValueSink<T> sink)
        {
            this.sink = sink;
        }

        @Override
        public void run()
        {
            while (running.get()) {
                T next;
                try {
                    next = queue.take();
                }
                catch (InterruptedException e) {
                    // Expected when cancelled.
                    if (running.get()) {
                        Thread.currentThread().interrupt();
                        log.warn("Queue reader '{}' interrupted without cancellation", threadName);
                    }
                    return;
                }

                if (!running.get()) {
                    return;
                }
                if (next == endOfStream) {
                    running.set(false);
                    sink.onClose();
                    return;
                }
                if (!sink.onValue(next)) {
                    // Sink stopped consuming; leave remaining values in the queue.
                    running.set(false);
                    return;
                }
            }
        }

        @Override
        public boolean cancel()
        {
            if (!running.compareAndSet(true, false)) {
                return false;
            }
            Thread t = thread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
            }
            return true;
        }
    }
}
