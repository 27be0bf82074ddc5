package com.questrail.filetransfer.receiver;

import com.questrail.filetransfer.metrics.TransferRecord;
import com.questrail.filetransfer.model.ReceiveState;
import com.questrail.filetransfer.model.TransferErrorKind;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one accepted connection.
 *
 * <p>Exactly one of {@code record} and {@code errorKind} is present:
 * {@code record} when {@code finalState} is {@link ReceiveState#COMPLETE},
 * {@code errorKind} when it is {@link ReceiveState#FAILED}.</p>
 */
public record ConnectionOutcome(
    InetSocketAddress remote,
    ReceiveState finalState,
    Optional<TransferRecord> record,
    Optional<TransferErrorKind> errorKind,
    String detail
) {
    public ConnectionOutcome {
        Objects.requireNonNull(finalState, "finalState");
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(errorKind, "errorKind");
        if (!finalState.isTerminal()) {
            throw new IllegalArgumentException("Outcome must be terminal: " + finalState);
        }
    }

    public static ConnectionOutcome completed(InetSocketAddress remote, TransferRecord record) {
        return new ConnectionOutcome(remote, ReceiveState.COMPLETE,
            Optional.of(record), Optional.empty(), "completed");
    }

    public static ConnectionOutcome failed(InetSocketAddress remote, TransferErrorKind kind, String detail) {
        return new ConnectionOutcome(remote, ReceiveState.FAILED,
            Optional.empty(), Optional.of(kind), detail);
    }

    public boolean isComplete() {
        return finalState == ReceiveState.COMPLETE;
    }
}
