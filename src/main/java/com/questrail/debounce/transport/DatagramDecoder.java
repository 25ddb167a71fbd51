package com.questrail.debounce.transport;

import java.net.SocketAddress;

/**
 * Decodes one inbound datagram into a value for debouncing.
 */
@FunctionalInterface
public interface DatagramDecoder<T>
{
    /**
     * @throws IllegalArgumentException if the payload is not a valid value
     */
    T decode(SocketAddress remote, byte[] payload);
}
