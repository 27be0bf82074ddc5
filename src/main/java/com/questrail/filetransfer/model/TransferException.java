package com.questrail.filetransfer.model;

import java.util.Objects;

/**
 * Indicates that a transfer could not proceed.
 *
 * <p>Raised inside the codec, transport and storage layers and converted into a
 * {@code TransferResult} or {@code ConnectionOutcome} at the sender/receiver
 * boundary. The {@link #kind()} carries the classification; the message is
 * diagnostic only.</p>
 */
public final class TransferException extends RuntimeException
{
    private final TransferErrorKind kind;

    public TransferException(TransferErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransferException(TransferErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransferErrorKind kind() {
        return kind;
    }
}
