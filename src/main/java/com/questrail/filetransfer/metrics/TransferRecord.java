package com.questrail.filetransfer.metrics;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One completed transfer, as persisted by a {@link MetricsRecorder}.
 *
 * <p>Created once, right after the last payload byte has been written, and
 * never mutated. {@code fileSizeBytes} is unsigned.</p>
 */
public record TransferRecord(
    LocalDateTime timestamp,
    String clientAddress,
    int clientPort,
    String filename,
    long fileSizeBytes,
    double durationSeconds,
    double throughputBytesPerSecond
) {
    public TransferRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(clientAddress, "clientAddress");
        Objects.requireNonNull(filename, "filename");
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0: " + durationSeconds);
        }
    }

    /**
     * Build a record, deriving throughput as {@code fileSize / duration}.
     *
     * <p>A zero duration yields a throughput of {@code 0} rather than a division
     * failure.</p>
     */
    public static TransferRecord completed(LocalDateTime timestamp,
                                           String clientAddress,
                                           int clientPort,
                                           String filename,
                                           long fileSizeBytes,
                                           double durationSeconds) {
        double throughput = durationSeconds == 0.0
                ? 0.0
                : unsignedToDouble(fileSizeBytes) / durationSeconds;
        return new TransferRecord(timestamp, clientAddress, clientPort, filename,
                fileSizeBytes, durationSeconds, throughput);
    }

    static double unsignedToDouble(long value) {
        if (value >= 0) {
            return (double) value;
        }
        // Halve to stay positive, then restore the dropped low bit.
        return ((double) (value >>> 1)) * 2.0 + (value & 1L);
    }
}
