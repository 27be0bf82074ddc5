package com.questrail.filetransfer.transport;

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;

/**
 * StreamConnection
 * -----------------------------------------------------------------------------
 * Minimal port for one reliable, ordered byte stream carrying one transfer.
 *
 * <p>Implementations may be a plain TCP socket, a TLS socket, or a test double.
 * Callers see the same exact-read and write semantics in every case; whether
 * the bytes are encrypted is invisible above this boundary.</p>
 *
 * <p>A connection is owned by exactly one party (the sender, or one iteration
 * of the receiver's accept loop) and must be closed by that owner on every exit
 * path.</p>
 */
public interface StreamConnection extends Closeable
{
    /**
     * Inbound bytes. Reads block until data arrives or the peer closes.
     */
    InputStream input();

    /**
     * Outbound bytes. Writes block until handed to the transport.
     */
    OutputStream output();

    /**
     * Remote endpoint of this connection.
     */
    InetSocketAddress remoteAddress();

    /**
     * True if the stream is protected by a completed TLS handshake.
     */
    boolean secure();
}
