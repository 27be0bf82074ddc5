package com.questrail.filetransfer.transport.tcp;

import com.questrail.filetransfer.transport.StreamConnection;
import com.questrail.filetransfer.transport.tls.SecureChannelAdapter;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;

/**
 * TcpListener
 * -----------------------------------------------------------------------------
 * Listening socket for the receiver.
 *
 * <p>Accepting and upgrading are separate steps so that the caller owns the raw
 * socket, and knows its peer, even when the TLS handshake fails.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind()} opens the listening socket ({@code SO_REUSEADDR}, backlog 5).
 * - {@link #acceptRaw()} blocks until the next peer connects.
 * - {@link #close()} releases the port; a blocked {@link #acceptRaw()} then
 *   fails with an {@link IOException}.
 */
public final class TcpListener implements Closeable
{
    private static final int BACKLOG = 5;

    private final InetSocketAddress bindAddress;
    private final SecureChannelAdapter tls;

    private volatile ServerSocket serverSocket;

    /**
     * @param tls server-side adapter, or {@code null} for plain TCP
     */
    public TcpListener(InetSocketAddress bindAddress, SecureChannelAdapter tls) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.tls = tls;
    }

    /**
     * Bind the listening socket.
     *
     * @return the bound local address (useful when binding port 0)
     */
    public InetSocketAddress bind() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Already bound to " + serverSocket.getLocalSocketAddress());
        }
        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(bindAddress, BACKLOG);
        }
        catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;
        return localAddress();
    }

    public InetSocketAddress localAddress() {
        return (InetSocketAddress) requireBound().getLocalSocketAddress();
    }

    public boolean secure() {
        return tls != null;
    }

    public Socket acceptRaw() throws IOException {
        return requireBound().accept();
    }

    /**
     * Wrap an accepted socket, running the server handshake in secure mode.
     *
     * @throws com.questrail.filetransfer.model.TransferException with kind
     *         {@code HANDSHAKE_FAILURE}; the socket is closed in that case
     */
    public StreamConnection open(Socket raw) throws IOException {
        Socket socket = (tls == null) ? raw : tls.upgradeServer(raw);
        return new SocketStreamConnection(socket);
    }

    public boolean isClosed() {
        ServerSocket socket = serverSocket;
        return socket != null && socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        ServerSocket socket = serverSocket;
        if (socket != null) {
            socket.close();
        }
    }

    private ServerSocket requireBound() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("TcpListener must be bound before use");
        }
        return socket;
    }
}
