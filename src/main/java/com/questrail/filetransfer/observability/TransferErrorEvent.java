package com.questrail.filetransfer.observability;

import com.questrail.filetransfer.model.ReceiveState;
import com.questrail.filetransfer.model.TransferErrorKind;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a failed connection on the receiving side.
 *
 * @param failedIn the state the connection was in when it failed; a failure in
 *                 {@link ReceiveState#RECEIVING_PAYLOAD} leaves a truncated
 *                 destination file on disk
 */
public record TransferErrorEvent(
    Instant timestamp,
    InetSocketAddress remote,
    ReceiveState failedIn,
    TransferErrorKind kind,
    String message,
    Throwable cause
) {
    public boolean leftPartialFile() {
        return failedIn == ReceiveState.RECEIVING_PAYLOAD;
    }
}
