package com.questrail.filetransfer.sender;

import com.questrail.filetransfer.codec.TransferHeaderEncoder;
import com.questrail.filetransfer.codec.impl.DefaultTransferHeaderEncoder;
import com.questrail.filetransfer.config.TransferConfig;
import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.transport.StreamConnection;
import com.questrail.filetransfer.transport.tcp.TcpConnector;
import com.questrail.filetransfer.transport.tls.SecureChannelAdapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FileSender
 * =============================================================================
 * Sends one file per connection: header first, then the content in chunks.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Path
 *     → pre-flight (regular file? name fits?)
 *       → TcpConnector (TLS handshake when configured)
 *         → TransferHeaderEncoder → header bytes
 *           → file content, at most chunkSize bytes per write
 * </pre>
 *
 * <p>Both pre-flight checks run before a connection is opened, and in secure
 * mode the handshake completes before the first header byte is written.</p>
 *
 * <h2>Completion</h2>
 * Fire-and-forget: once every byte has been written and flushed the connection
 * is closed and the transfer counts as sent. No acknowledgment is read.
 *
 * <p>Failures are returned as a failed {@link TransferResult}, never thrown.</p>
 */
public final class FileSender {
    private static final Logger log = LoggerFactory.getLogger(FileSender.class);

    private final TransferConfig config;
    private final TransferHeaderEncoder encoder;
    private final TcpConnector connector;

    public FileSender(TransferConfig config) {
        this(config, new DefaultTransferHeaderEncoder());
    }

    /**
     * In secure mode the trust anchor is loaded here, once.
     */
    public FileSender(TransferConfig config, TransferHeaderEncoder encoder) {
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        SecureChannelAdapter tls = config.secureChannel()
                .map(SecureChannelAdapter::forClient)
                .orElse(null);
        this.connector = new TcpConnector(tls);
    }

    public boolean secure() {
        return config.secure();
    }

    /**
     * Send {@code file} to {@code host:port} over one new connection.
     */
    public TransferResult send(String host, int port, Path file) {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(file, "file");

        String filename = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        long startNanos = System.nanoTime();
        try {
            long sent = transfer(host, port, file, filename);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            log.info("Sent '{}' ({} bytes) to {}:{}{}", filename, sent, host, port, secure() ? " (TLS)" : "");
            return TransferResult.succeeded(filename, sent, elapsed);
        }
        catch (TransferException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            log.error("Sending '{}' to {}:{} failed ({}): {}", filename, host, port, e.kind(), e.getMessage());
            return TransferResult.failed(filename, e.kind(), e.getMessage(), elapsed);
        }
    }

    /**
     * Send the same file {@code repeat} times, one independent connection per
     * repetition. The first failure ends the run.
     *
     * @return the results of the attempts made; only the last can be a failure
     */
    public List<TransferResult> sendRepeatedly(String host, int port, Path file, int repeat) {
        if (repeat < 1) {
            throw new IllegalArgumentException("repeat must be >= 1: " + repeat);
        }
        List<TransferResult> results = new ArrayList<>(repeat);
        for (int i = 1; i <= repeat; i++) {
            log.debug("Transfer {}/{}", i, repeat);
            TransferResult result = send(host, port, file);
            results.add(result);
            if (!result.isSuccess()) {
                break;
            }
        }
        return results;
    }

    private long transfer(String host, int port, Path file, String filename) {
        if (!Files.isRegularFile(file)) {
            throw new TransferException(TransferErrorKind.FILE_NOT_FOUND, "File not found: " + file);
        }

        final long fileSize;
        try {
            fileSize = Files.size(file);
        }
        catch (IOException e) {
            throw new TransferException(TransferErrorKind.IO_FAILURE, "Unable to stat " + file, e);
        }

        // NAME_TOO_LONG surfaces here, before any connection exists.
        byte[] header = encoder.encode(filename, fileSize);

        try (StreamConnection connection = connector.connect(host, port);
             InputStream content = Files.newInputStream(file)) {
            OutputStream out = connection.output();
            out.write(header);

            byte[] chunk = new byte[config.chunkSize()];
            long remaining = fileSize;
            while (remaining > 0) {
                int n = content.read(chunk, 0, (int) Math.min(chunk.length, remaining));
                if (n < 0) {
                    throw new TransferException(TransferErrorKind.IO_FAILURE,
                            file + " shrank during transfer; " + remaining + " bytes missing");
                }
                out.write(chunk, 0, n);
                remaining -= n;
            }
            out.flush();
            return fileSize;
        }
        catch (IOException e) {
            throw new TransferException(TransferErrorKind.IO_FAILURE,
                    "Transfer of " + file + " to " + host + ":" + port + " failed: " + e.getMessage(), e);
        }
    }
}
