/**
 * Datagram Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP, a simulator, or a
 * test double) and the debounce pipeline.
 *
 * <p>Everything above the endpoint sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Endpoint implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only; decoding belongs to a {@link com.questrail.debounce.transport.DatagramDecoder}</li>
 *   <li>Deliver listener callbacks serially</li>
 *   <li>Not schedule delays or retries</li>
 * </ul>
 *
 * <p>{@link com.questrail.debounce.transport.DatagramValueSource} adapts an
 * endpoint into a value source that the operator can attach to.</p>
 */
package com.questrail.debounce.transport;
