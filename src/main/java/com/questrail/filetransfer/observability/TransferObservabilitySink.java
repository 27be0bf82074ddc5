package com.questrail.filetransfer.observability;

import com.questrail.filetransfer.metrics.TransferRecord;

import java.net.InetSocketAddress;

/**
 * Main interface for receiving receiver-side observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface TransferObservabilitySink {
    /**
     * Called when a connection has been accepted, before any handshake.
     * @param remote the peer
     * @param secure whether a TLS handshake will follow
     */
    void onConnectionAccepted(InetSocketAddress remote, boolean secure);

    /**
     * Called on every receive state transition.
     * @param event the transition details
     */
    void onStateTransition(ReceiveStateTransitionEvent event);

    /**
     * Called once the payload is on disk and the record has been appended.
     * @param record the persisted record
     */
    void onTransferCompleted(TransferRecord record);

    /**
     * Called when a connection fails, including failed handshakes.
     * @param event the error event
     */
    void onError(TransferErrorEvent event);
}
