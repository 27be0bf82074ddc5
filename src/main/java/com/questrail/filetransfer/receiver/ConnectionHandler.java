package com.questrail.filetransfer.receiver;

import com.questrail.filetransfer.codec.TransferHeaderDecoder;
import com.questrail.filetransfer.codec.impl.ExactReads;
import com.questrail.filetransfer.config.TransferConfig;
import com.questrail.filetransfer.metrics.MetricsRecorder;
import com.questrail.filetransfer.metrics.TransferRecord;
import com.questrail.filetransfer.model.ReceiveState;
import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.model.TransferHeader;
import com.questrail.filetransfer.observability.ReceiveStateTransitionEvent;
import com.questrail.filetransfer.observability.TransferErrorEvent;
import com.questrail.filetransfer.observability.TransferObservabilitySink;
import com.questrail.filetransfer.transport.StreamConnection;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * ConnectionHandler
 * =============================================================================
 * Processes one already-established connection end to end: decode the header,
 * drain the payload to disk, append the metrics record.
 *
 * <h2>Architectural role</h2>
 * This is the unit of work of the receiver. It holds no per-connection state
 * between calls, so the accept loop could dispatch it as one task per
 * connection; in that case the {@link MetricsRecorder} is the only shared
 * resource and must serialize its writes.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE → AWAITING_NAME_LEN → AWAITING_NAME → AWAITING_SIZE → RECEIVING_PAYLOAD → COMPLETE
 *                         (any failure) ──────────────────────────────────────→ FAILED
 * </pre>
 *
 * <h2>Failure policy</h2>
 * Failures never escape {@link #handle(StreamConnection)}; they are reported to
 * the observability sink and returned as a failed {@link ConnectionOutcome}. A
 * payload cut short leaves the truncated destination file in place and emits no
 * record. Closing the connection is the caller's responsibility.
 */
public final class ConnectionHandler
{
    private final TransferConfig config;
    private final TransferHeaderDecoder decoder;
    private final MetricsRecorder recorder;
    private final TransferObservabilitySink sink;
    private final Clock clock;

    public ConnectionHandler(TransferConfig config,
                             TransferHeaderDecoder decoder,
                             MetricsRecorder recorder,
                             TransferObservabilitySink sink,
                             Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ConnectionOutcome handle(StreamConnection connection) {
        Objects.requireNonNull(connection, "connection");
        StateTracker state = new StateTracker(connection.remoteAddress());

        LocalDateTime startedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        long startNanos = System.nanoTime();

        try {
            TransferHeader header = decoder.decode(connection.input(), state::moveTo);
            Path destination = resolveDestination(header.filename());

            state.moveTo(ReceiveState.RECEIVING_PAYLOAD);
            drain(connection.input(), header.fileSize(), destination);

            double durationSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            InetSocketAddress remote = connection.remoteAddress();
            TransferRecord record = TransferRecord.completed(
                    startedAt,
                    remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString(),
                    remote.getPort(),
                    header.filename(),
                    header.fileSize(),
                    durationSeconds);
            recorder.append(record);

            state.moveTo(ReceiveState.COMPLETE);
            sink.onTransferCompleted(record);
            return ConnectionOutcome.completed(remote, record);
        }
        catch (TransferException e) {
            ReceiveState failedIn = state.current();
            state.moveTo(ReceiveState.FAILED);
            sink.onError(new TransferErrorEvent(Instant.now(clock), connection.remoteAddress(),
                    failedIn, e.kind(), e.getMessage(), e.getCause()));
            return ConnectionOutcome.failed(connection.remoteAddress(), e.kind(), e.getMessage());
        }
    }

    /**
     * Resolve the client-supplied name inside the receive directory.
     *
     * <p>Names that are empty, absolute, or that climb out of the directory
     * after normalization are rejected.</p>
     */
    Path resolveDestination(String filename) {
        Path base = config.receiveDirectory().toAbsolutePath().normalize();
        Path destination;
        try {
            destination = base.resolve(filename).normalize();
        }
        catch (InvalidPathException e) {
            throw new TransferException(TransferErrorKind.UNSAFE_FILENAME,
                    "Invalid file name '" + filename + "'", e);
        }
        if (destination.equals(base) || !destination.startsWith(base)) {
            throw new TransferException(TransferErrorKind.UNSAFE_FILENAME,
                    "File name '" + filename + "' resolves outside " + base);
        }
        return destination;
    }

    private void drain(InputStream input, long fileSize, Path destination) {
        try {
            Files.createDirectories(destination.getParent());
        }
        catch (IOException e) {
            throw new TransferException(TransferErrorKind.IO_FAILURE,
                    "Unable to create " + destination.getParent(), e);
        }

        byte[] chunk = new byte[config.chunkSize()];
        long remaining = fileSize;

        try (OutputStream out = Files.newOutputStream(destination)) {
            // remaining is unsigned; 0 is the only terminal value
            while (remaining != 0) {
                int toRead = Long.compareUnsigned(remaining, chunk.length) < 0 ? (int) remaining : chunk.length;
                ExactReads.readExactly(input, chunk, 0, toRead);
                out.write(chunk, 0, toRead);
                remaining -= toRead;
            }
        }
        catch (IOException e) {
            throw new TransferException(TransferErrorKind.IO_FAILURE,
                    "Unable to write " + destination, e);
        }
    }

    private final class StateTracker {
        private final InetSocketAddress remote;
        private ReceiveState current = ReceiveState.IDLE;

        StateTracker(InetSocketAddress remote) {
            this.remote = remote;
        }

        ReceiveState current() {
            return current;
        }

        void moveTo(ReceiveState next) {
            ReceiveState previous = current;
            current = next;
            sink.onStateTransition(new ReceiveStateTransitionEvent(Instant.now(clock), remote, previous, next));
        }
    }
}
