package com.questrail.debounce.source;

import com.questrail.debounce.internal.time.Cancellable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueueValueSourceTest
 * -----------------------------------------------------------------------------
 * Real-thread tests; every wait is bounded by a latch with a generous timeout.
 */
class QueueValueSourceTest {

    private static final String END = new String("END");

    /**
     * Sink that records values and accepts at most {@code capacity} of them.
     */
    private static final class CollectingSink implements ValueSink<String> {
        final List<String> values = new CopyOnWriteArrayList<>();
        final CountDownLatch closed = new CountDownLatch(1);
        final CountDownLatch received;
        final int capacity;

        CollectingSink(int expected, int capacity) {
            this.received = new CountDownLatch(expected);
            this.capacity = capacity;
        }

        @Override
        public boolean onValue(String value) {
            if (values.size() >= capacity) {
                return false;
            }
            values.add(value);
            received.countDown();
            return true;
        }

        @Override
        public void onClose() {
            closed.countDown();
        }

        @Override
        public void onError(Throwable cause) {
            fail("unexpected source failure: " + cause);
        }
    }

    @Test
    void deliversValuesInQueueOrderThenClosesOnMarker() throws InterruptedException {
        BlockingQueue<String> queue = new LinkedBlockingQueue<>(List.of("a", "b", "c"));
        CollectingSink sink = new CollectingSink(3, Integer.MAX_VALUE);

        new QueueValueSource<>(queue, END, "queue-reader").open(sink);
        queue.put(END);

        assertTrue(sink.closed.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b", "c"), sink.values);
    }

    @Test
    void markerIsComparedByIdentity() throws InterruptedException {
        BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        CollectingSink sink = new CollectingSink(1, Integer.MAX_VALUE);

        new QueueValueSource<>(queue, END, "queue-reader").open(sink);
        queue.put("END");

        assertTrue(sink.received.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("END"), sink.values);
        assertEquals(1, sink.closed.getCount(), "an equal but distinct value is ordinary data");
    }

    @Test
    void cancelStopsReaderWithoutClosingSink() throws InterruptedException {
        BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        CollectingSink sink = new CollectingSink(1, Integer.MAX_VALUE);
        Cancellable handle = new QueueValueSource<>(queue, END, "queue-reader").open(sink);

        queue.put("a");
        assertTrue(sink.received.await(2, TimeUnit.SECONDS));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        queue.put("b");
        queue.put(END);

        assertFalse(sink.closed.await(200, TimeUnit.MILLISECONDS));
        assertEquals(List.of("a"), sink.values);
    }

    @Test
    void readerStopsWhenSinkRefusesValues() throws InterruptedException {
        BlockingQueue<String> queue = new LinkedBlockingQueue<>(List.of("a", "b", "c"));
        CollectingSink sink = new CollectingSink(1, 1);
        new QueueValueSource<>(queue, END, "queue-reader").open(sink);

        assertTrue(sink.received.await(2, TimeUnit.SECONDS));
        // "b" is taken and refused; "c" stays queued.
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (queue.size() > 1 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(100);

        assertEquals(List.of("a"), sink.values);
        assertEquals(List.of("c"), List.copyOf(queue));
    }

    @Test
    void canOnlyBeOpenedOnce() {
        QueueValueSource<String> source = new QueueValueSource<>(new LinkedBlockingQueue<>(), END, "queue-reader");
        Cancellable handle = source.open(new CollectingSink(0, Integer.MAX_VALUE));
        try {
            assertThrows(IllegalStateException.class, () -> source.open(new CollectingSink(0, Integer.MAX_VALUE)));
        } finally {
            handle.cancel();
        }
    }
}
