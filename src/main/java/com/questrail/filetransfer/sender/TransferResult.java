package com.questrail.filetransfer.sender;

import com.questrail.filetransfer.model.TransferErrorKind;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Sender-side result of one transfer attempt.
 *
 * <p>Success means every header and payload byte was handed to the transport;
 * the receiver does not acknowledge anything, so it says nothing about
 * receiver-side completion. {@code duration} is client-side wall-clock time
 * from pre-flight to close.</p>
 */
public record TransferResult(
    String filename,
    long bytesSent,
    Duration duration,
    Optional<TransferErrorKind> errorKind,
    String detail
) {
    public TransferResult {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(errorKind, "errorKind");
    }

    public static TransferResult succeeded(String filename, long bytesSent, Duration duration) {
        return new TransferResult(filename, bytesSent, duration, Optional.empty(), "sent");
    }

    public static TransferResult failed(String filename, TransferErrorKind kind, String detail, Duration duration) {
        return new TransferResult(filename, 0L, duration, Optional.of(kind), detail);
    }

    public boolean isSuccess() {
        return errorKind.isEmpty();
    }
}
