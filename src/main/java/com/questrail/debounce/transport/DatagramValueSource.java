package com.questrail.debounce.transport;

import com.questrail.debounce.internal.time.Cancellable;
import com.questrail.debounce.source.ValueSink;
import com.questrail.debounce.source.ValueSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramValueSource
 * =============================================================================
 * {@link ValueSource} backed by a {@link DatagramEndpoint}: every inbound
 * datagram is decoded and offered to the sink.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Undecodable datagrams are dropped and logged; they do not end the stream.</li>
 *   <li>An orderly transport down closes the sink; a transport failure is
 *       reported through {@link ValueSink#onError(Throwable)}.</li>
 *   <li>Cancelling the handle detaches the sink and stops the endpoint.</li>
 * </ul>
 *
 * <p>Ordering follows the endpoint's serialized callback guarantee.</p>
 */
public final class DatagramValueSource<T> implements ValueSource<T>
{
    private static final Logger log = LoggerFactory.getLogger(DatagramValueSource.class);

    private final DatagramEndpoint endpoint;
    private final DatagramDecoder<T> decoder;

    public DatagramValueSource(DatagramEndpoint endpoint, DatagramDecoder<T> decoder)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public Cancellable open(ValueSink<T> sink)
    {
        Objects.requireNonNull(sink, "sink");

        Subscription subscription = new Subscription(sink);
        endpoint.setListener(subscription);
        endpoint.start();
        return subscription;
    }

    private final class Subscription implements DatagramEndpointListener, Cancellable
    {
        private final ValueSink<T> sink;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Subscription(ValueSink<T> sink)
        {
            this.sink = sink;
        }

        @Override
        public void onTransportUp()
        {
            log.debug("Datagram source is up");
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            if (cause == null) {
                sink.onClose();
            }
            else {
                sink.onError(cause);
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            if (!active.get()) {
                return;
            }

            T value;
            try {
                value = decoder.decode(remote, payload);
            }
            catch (RuntimeException e) {
                log.warn("Dropping undecodable datagram ({} bytes) from {}: {}", payload.length, remote, e.getMessage());
                return;
            }

            if (!sink.onValue(value)) {
                cancel();
            }
        }

        @Override
        public boolean cancel()
        {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            endpoint.stop();
            return true;
        }
    }
}
