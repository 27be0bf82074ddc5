package com.questrail.filetransfer.observability;

import com.questrail.filetransfer.metrics.TransferRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Locale;

/**
 * Production implementation of TransferObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTransferObservabilitySink implements TransferObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTransferObservabilitySink.class);

    @Override
    public void onConnectionAccepted(InetSocketAddress remote, boolean secure) {
        log.info("Connection from {}{}", remote, secure ? " (TLS)" : "");
    }

    @Override
    public void onStateTransition(ReceiveStateTransitionEvent event) {
        log.debug("{}: {} -> {}", event.remote(), event.oldState(), event.newState());
    }

    @Override
    public void onTransferCompleted(TransferRecord record) {
        log.info("Received '{}' ({} bytes) from {}:{} in {} s",
            record.filename(),
            Long.toUnsignedString(record.fileSizeBytes()),
            record.clientAddress(),
            record.clientPort(),
            String.format(Locale.ROOT, "%.6f", record.durationSeconds()));
    }

    @Override
    public void onError(TransferErrorEvent event) {
        if (event.leftPartialFile()) {
            log.error("Transfer from {} failed ({}) mid-payload; destination file may be incomplete: {}",
                event.remote(), event.kind(), event.message(), event.cause());
        } else {
            log.error("Transfer from {} failed ({}) in {}: {}",
                event.remote(), event.kind(), event.failedIn(), event.message(), event.cause());
        }
    }
}
