package com.questrail.filetransfer.receiver;

import com.questrail.filetransfer.codec.TransferHeaderDecoder;
import com.questrail.filetransfer.codec.impl.DefaultTransferHeaderDecoder;
import com.questrail.filetransfer.config.TransferConfig;
import com.questrail.filetransfer.metrics.CsvMetricsRecorder;
import com.questrail.filetransfer.metrics.MetricsRecorder;
import com.questrail.filetransfer.model.ReceiveState;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.observability.NullObservabilitySink;
import com.questrail.filetransfer.observability.TransferErrorEvent;
import com.questrail.filetransfer.observability.TransferObservabilitySink;
import com.questrail.filetransfer.transport.StreamConnection;
import com.questrail.filetransfer.transport.tcp.TcpListener;
import com.questrail.filetransfer.transport.tls.SecureChannelAdapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * FileReceiver
 * =============================================================================
 * Composition root and lifecycle owner for the receiving side.
 *
 * <h2>Execution model</h2>
 * One blocking, strictly sequential accept loop. Each accepted connection is
 * fully processed (handshake, header, payload, metrics) before the next
 * {@code accept}. Connections are therefore handled in acceptance order and
 * never interleaved, and the metrics store has a single writer.
 *
 * <p>There are no read timeouts: a peer that stalls mid-transfer blocks the
 * loop until it sends more data or closes.</p>
 *
 * <h2>Failure isolation</h2>
 * A failed handshake or transfer ends that connection only. It is reported to
 * the {@link TransferObservabilitySink} and the loop proceeds to the next
 * accept. Only closing the receiver ends {@link #serve()}.
 */
public final class FileReceiver implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(FileReceiver.class);

    private final TcpListener listener;
    private final ConnectionHandler handler;
    private final TransferObservabilitySink sink;

    private volatile boolean closed;

    private FileReceiver(TcpListener listener, ConnectionHandler handler, TransferObservabilitySink sink) {
        this.listener = listener;
        this.handler = handler;
        this.sink = sink;
    }

    /**
     * Bind the listening socket.
     *
     * @return the bound local address
     */
    public InetSocketAddress bind() throws IOException {
        InetSocketAddress local = listener.bind();
        log.info("Listening on {}{}", local, listener.secure() ? " (TLS)" : "");
        return local;
    }

    /**
     * Accept and fully process exactly one connection.
     *
     * @return the outcome of that connection; handshake and transfer failures
     *         are reported here, not thrown
     * @throws IOException if {@code accept} itself fails (for example because
     *         the receiver was closed)
     */
    public ConnectionOutcome acceptOne() throws IOException {
        Socket raw = listener.acceptRaw();
        InetSocketAddress remote = (InetSocketAddress) raw.getRemoteSocketAddress();
        sink.onConnectionAccepted(remote, listener.secure());

        StreamConnection connection = null;
        try {
            connection = listener.open(raw);
            return handler.handle(connection);
        }
        catch (TransferException e) {
            sink.onError(new TransferErrorEvent(Instant.now(), remote, ReceiveState.IDLE,
                e.kind(), e.getMessage(), e.getCause()));
            return ConnectionOutcome.failed(remote, e.kind(), e.getMessage());
        }
        finally {
            release(connection, remote);
            release(raw, remote);
        }
    }

    /**
     * Run the accept loop until {@link #close()} is called.
     *
     * @throws IllegalStateException if {@link #bind()} has not been called
     */
    public void serve() {
        log.debug("Serving on {}", listener.localAddress());
        while (!closed) {
            try {
                acceptOne();
            }
            catch (IOException e) {
                if (closed || listener.isClosed()) {
                    break;
                }
                log.warn("Accept failed; continuing", e);
            }
            catch (RuntimeException e) {
                // Resources were released by acceptOne; keep serving.
                log.error("Unexpected fault while handling a connection", e);
            }
        }
        log.info("Receiver stopped");
    }

    @Override
    public void close() throws IOException {
        closed = true;
        listener.close();
    }

    private static void release(Closeable resource, InetSocketAddress remote) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        }
        catch (IOException e) {
            log.debug("Close failed for connection from {}", remote, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TransferConfig config = TransferConfig.plainDefaults();
        private InetSocketAddress bindAddress;
        private TransferHeaderDecoder decoder = new DefaultTransferHeaderDecoder();
        private MetricsRecorder recorder;
        private TransferObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemDefaultZone();

        public Builder withConfig(TransferConfig config) {
            this.config = config;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        public Builder withDecoder(TransferHeaderDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withMetricsRecorder(MetricsRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public Builder withObservabilitySink(TransferObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Assemble the receiver. In secure mode the certificate and key are
         * loaded here, once, for the lifetime of the receiver.
         */
        public FileReceiver build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(bindAddress, "bindAddress");

            SecureChannelAdapter tls = config.secureChannel()
                .map(SecureChannelAdapter::forServer)
                .orElse(null);

            MetricsRecorder effectiveRecorder = recorder != null
                ? recorder
                : new CsvMetricsRecorder(config.metricsFile());

            ConnectionHandler handler = new ConnectionHandler(
                config,
                decoder,
                effectiveRecorder,
                observabilitySink,
                clock);

            return new FileReceiver(new TcpListener(bindAddress, tls), handler, observabilitySink);
        }
    }
}
