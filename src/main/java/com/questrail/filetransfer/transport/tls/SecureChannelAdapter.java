package com.questrail.filetransfer.transport.tls;

import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;

import io.netty.handler.ssl.JdkSslContext;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;

import java.io.IOException;
import java.net.Socket;
import java.nio.file.Path;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

/**
 * SecureChannelAdapter
 * =============================================================================
 * Upgrades a connected TCP socket to TLS, in either the client or the server
 * role.
 *
 * <h2>Role</h2>
 * <ul>
 *   <li><strong>Client</strong>: validates the server's certificate chain
 *       against the single trust anchor of its {@link SecureChannelConfig}.
 *       Host-name verification is {@link HostnameVerification#DISABLED}.</li>
 *   <li><strong>Server</strong>: presents the one certificate/key pair of its
 *       {@link SecureChannelConfig} to every incoming connection.</li>
 * </ul>
 *
 * <h2>TLS material</h2>
 * PEM files are loaded once, at construction, through Netty's
 * {@link SslContextBuilder} with the JDK provider. Only the resulting
 * {@link SSLContext} is kept; Netty types do not escape this class.
 *
 * <h2>Handshake</h2>
 * Each upgrade runs the handshake eagerly, before the socket is returned, so no
 * application byte is ever written on an unauthenticated channel. A failed
 * handshake closes the socket and raises {@link TransferErrorKind#HANDSHAKE_FAILURE}.
 */
public final class SecureChannelAdapter
{
    private enum Role { CLIENT, SERVER }

    private final SSLContext sslContext;
    private final Role role;
    private final HostnameVerification hostnameVerification;

    private SecureChannelAdapter(SSLContext sslContext, Role role, HostnameVerification hostnameVerification) {
        this.sslContext = sslContext;
        this.role = role;
        this.hostnameVerification = hostnameVerification;
    }

    /**
     * Client-side adapter; requires {@link SecureChannelConfig#trustAnchor()}.
     */
    public static SecureChannelAdapter forClient(SecureChannelConfig config) {
        Objects.requireNonNull(config, "config");
        Path anchor = config.trustAnchor()
                .orElseThrow(() -> new IllegalArgumentException("Client TLS requires a trust anchor"));
        try {
            SslContext context = SslContextBuilder.forClient()
                    .sslProvider(SslProvider.JDK)
                    .trustManager(anchor.toFile())
                    .build();
            return new SecureChannelAdapter(jdkContext(context), Role.CLIENT, config.hostnameVerification());
        }
        catch (SSLException | IllegalArgumentException e) {
            throw new TransferException(TransferErrorKind.HANDSHAKE_FAILURE,
                    "Unable to load trust anchor " + anchor, e);
        }
    }

    /**
     * Server-side adapter; requires the certificate chain and private key.
     */
    public static SecureChannelAdapter forServer(SecureChannelConfig config) {
        Objects.requireNonNull(config, "config");
        Path chain = config.certificateChain()
                .orElseThrow(() -> new IllegalArgumentException("Server TLS requires a certificate chain"));
        Path key = config.privateKey()
                .orElseThrow(() -> new IllegalArgumentException("Server TLS requires a private key"));
        try {
            SslContext context = SslContextBuilder.forServer(chain.toFile(), key.toFile())
                    .sslProvider(SslProvider.JDK)
                    .build();
            return new SecureChannelAdapter(jdkContext(context), Role.SERVER, config.hostnameVerification());
        }
        catch (SSLException | IllegalArgumentException e) {
            throw new TransferException(TransferErrorKind.HANDSHAKE_FAILURE,
                    "Unable to load certificate " + chain + " / key " + key, e);
        }
    }

    /**
     * Layer TLS over a connected socket as the client and complete the handshake.
     *
     * @param raw connected TCP socket; owned by the returned socket afterwards
     * @param host host name used for SNI only
     */
    public SSLSocket upgradeClient(Socket raw, String host, int port) {
        requireRole(Role.CLIENT);
        SSLSocket socket = layer(raw, () -> (SSLSocket) factory().createSocket(raw, host, port, true));
        socket.setUseClientMode(true);

        SSLParameters parameters = socket.getSSLParameters();
        if (hostnameVerification == HostnameVerification.DISABLED) {
            parameters.setEndpointIdentificationAlgorithm(null);
        }
        socket.setSSLParameters(parameters);

        return handshake(socket);
    }

    /**
     * Layer TLS over an accepted socket as the server and complete the handshake.
     */
    public SSLSocket upgradeServer(Socket raw) {
        requireRole(Role.SERVER);
        // No consumed bytes; the factory puts the socket in server mode.
        SSLSocket socket = layer(raw, () -> (SSLSocket) factory().createSocket(raw, null, true));
        return handshake(socket);
    }

    private SSLSocketFactory factory() {
        return sslContext.getSocketFactory();
    }

    private void requireRole(Role expected) {
        if (role != expected) {
            throw new IllegalStateException("Adapter built for " + role + " cannot act as " + expected);
        }
    }

    private static SSLSocket handshake(SSLSocket socket) {
        try {
            socket.startHandshake();
            return socket;
        }
        catch (IOException e) {
            closeAfterFailure(socket, e);
            throw new TransferException(TransferErrorKind.HANDSHAKE_FAILURE,
                    "TLS handshake failed: " + e.getMessage(), e);
        }
    }

    private static SSLSocket layer(Socket raw, SocketLayering layering) {
        try {
            return layering.layer();
        }
        catch (IOException e) {
            closeAfterFailure(raw, e);
            throw new TransferException(TransferErrorKind.HANDSHAKE_FAILURE,
                    "Unable to layer TLS over " + raw.getRemoteSocketAddress(), e);
        }
    }

    private static void closeAfterFailure(Socket socket, IOException failure) {
        try {
            socket.close();
        }
        catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private static SSLContext jdkContext(SslContext context) {
        // SslProvider.JDK always yields a JdkSslContext.
        return ((JdkSslContext) context).context();
    }

    @FunctionalInterface
    private interface SocketLayering {
        SSLSocket layer() throws IOException;
    }
}
