/**
 * Transfer Transport Ports
 * =============================================================================
 *
 * These types define the <em>transport boundary</em> between a concrete stream
 * implementation (plain TCP, TLS over TCP, or a test double) and the sender and
 * receiver.
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>an {@link java.io.InputStream} and an {@link java.io.OutputStream}</li>
 *   <li>the remote endpoint as an {@link java.net.InetSocketAddress}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no header decoding, no payload accounting)</li>
 *   <li>Complete any TLS handshake before handing out the connection</li>
 *   <li>Not add read timeouts, retries or buffering policy</li>
 * </ul>
 */
package com.questrail.filetransfer.transport;
