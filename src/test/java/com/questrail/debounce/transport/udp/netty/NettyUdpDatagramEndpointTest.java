package com.questrail.debounce.transport.udp.netty;

import com.questrail.debounce.transport.DatagramEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDatagramEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback test against a real socket bound to an ephemeral port.
 */
class NettyUdpDatagramEndpointTest {

    private NettyUdpDatagramEndpoint endpoint;

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.stop();
        }
    }

    private static final class RecordingListener implements DatagramEndpointListener {
        final CountDownLatch up = new CountDownLatch(1);
        final CountDownLatch down = new CountDownLatch(1);
        final CountDownLatch received;
        final List<String> payloads = new CopyOnWriteArrayList<>();
        final AtomicInteger downCount = new AtomicInteger();

        RecordingListener(int expected) {
            this.received = new CountDownLatch(expected);
        }

        @Override
        public void onTransportUp() {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            downCount.incrementAndGet();
            down.countDown();
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            payloads.add(new String(payload, StandardCharsets.US_ASCII));
            received.countDown();
        }
    }

    @Test
    void receivesLoopbackDatagramsAsByteArrays() throws Exception {
        RecordingListener listener = new RecordingListener(2);
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
        endpoint.setListener(listener);

        endpoint.start();
        assertTrue(listener.up.await(5, TimeUnit.SECONDS), "endpoint should bind");
        SocketAddress local = endpoint.localAddress();
        assertNotNull(local);

        try (DatagramSocket client = new DatagramSocket()) {
            for (String text : List.of("first", "second")) {
                byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
                client.send(new DatagramPacket(bytes, bytes.length, local));
            }
        }

        assertTrue(listener.received.await(5, TimeUnit.SECONDS), "datagrams should arrive");
        assertEquals(List.of("first", "second"), listener.payloads);
    }

    @Test
    void stopReportsTransportDownOnce() throws Exception {
        RecordingListener listener = new RecordingListener(0);
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
        endpoint.setListener(listener);
        endpoint.start();
        assertTrue(listener.up.await(5, TimeUnit.SECONDS));

        endpoint.stop();

        assertTrue(listener.down.await(5, TimeUnit.SECONDS));
        // Channel inactivity after close must not produce a second notification.
        Thread.sleep(200);
        assertEquals(1, listener.downCount.get());
    }

    @Test
    void startWithoutListenerIsRejected() {
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));

        assertThrows(IllegalStateException.class, endpoint::start);
    }
}
