package com.questrail.filetransfer.transport.tcp;

import com.questrail.filetransfer.transport.StreamConnection;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Objects;
import javax.net.ssl.SSLSocket;

/**
 * {@link StreamConnection} backed by a connected {@link Socket}.
 *
 * <p>The socket may be a plain TCP socket or an {@link SSLSocket} whose
 * handshake has already completed. Closing this connection closes the socket
 * (and, for a layered TLS socket, the TCP socket beneath it).</p>
 */
public final class SocketStreamConnection implements StreamConnection
{
    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;
    private final InetSocketAddress remote;

    public SocketStreamConnection(Socket socket) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.input = socket.getInputStream();
        this.output = socket.getOutputStream();
        this.remote = (InetSocketAddress) socket.getRemoteSocketAddress();
    }

    @Override
    public InputStream input() {
        return input;
    }

    @Override
    public OutputStream output() {
        return output;
    }

    @Override
    public InetSocketAddress remoteAddress() {
        return remote;
    }

    @Override
    public boolean secure() {
        return socket instanceof SSLSocket;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    @Override
    public String toString() {
        return "SocketStreamConnection[remote=" + remote + ", secure=" + secure() + ']';
    }
}
