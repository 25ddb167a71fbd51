package com.questrail.debounce.transport;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Receive-side datagram transport.
 *
 * <p>An endpoint delivers raw payloads and up/down signals to a single
 * {@link DatagramEndpointListener}; turning payloads into values is left to
 * {@link DatagramValueSource}.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Installs the listener. Required before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * Begins receiving. The listener is told {@code onTransportUp} once the
     * endpoint is usable, or {@code onTransportDown(cause)} if it never becomes so.
     *
     * @throws IllegalStateException if no listener has been installed
     */
    void start();

    /**
     * Stops receiving and releases transport resources. The listener hears
     * {@code onTransportDown(null)} unless the endpoint was already down.
     */
    void stop();
}
