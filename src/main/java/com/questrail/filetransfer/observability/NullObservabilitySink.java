package com.questrail.filetransfer.observability;

import com.questrail.filetransfer.metrics.TransferRecord;

import java.net.InetSocketAddress;

/**
 * No-op implementation of TransferObservabilitySink.
 */
public final class NullObservabilitySink implements TransferObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionAccepted(InetSocketAddress remote, boolean secure) {}

    @Override
    public void onStateTransition(ReceiveStateTransitionEvent event) {}

    @Override
    public void onTransferCompleted(TransferRecord record) {}

    @Override
    public void onError(TransferErrorEvent event) {}
}
