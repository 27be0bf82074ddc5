package com.questrail.filetransfer.transport.tcp;

import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.transport.StreamConnection;
import com.questrail.filetransfer.transport.tls.SecureChannelAdapter;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Opens outbound connections for the sender.
 *
 * <p>When constructed with a {@link SecureChannelAdapter}, every connection is
 * upgraded to TLS (handshake included) before it is returned.</p>
 */
public final class TcpConnector
{
    private final SecureChannelAdapter tls;

    /**
     * @param tls client-side adapter, or {@code null} for plain TCP
     */
    public TcpConnector(SecureChannelAdapter tls) {
        this.tls = tls;
    }

    public StreamConnection connect(String host, int port) {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port));
        }
        catch (IOException | IllegalArgumentException e) {
            try {
                socket.close();
            }
            catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new TransferException(TransferErrorKind.CONNECTION_FAILED,
                    "Unable to connect to " + host + ":" + port + ": " + e.getMessage(), e);
        }

        Socket connected = (tls == null) ? socket : tls.upgradeClient(socket, host, port);
        try {
            return new SocketStreamConnection(connected);
        }
        catch (IOException e) {
            try {
                connected.close();
            }
            catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new TransferException(TransferErrorKind.CONNECTION_FAILED,
                    "Connection to " + host + ":" + port + " unusable", e);
        }
    }
}
