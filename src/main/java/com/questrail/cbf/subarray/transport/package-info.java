/**
 * Model Feed Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP in production, a fake in tests) and the model-update scheduler.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <p>Implementations perform I/O only. They do not parse model documents and
 * do not schedule anything.</p>
 */
package com.questrail.cbf.subarray.transport;
