package com.questrail.filetransfer.observability;

import com.questrail.filetransfer.metrics.TransferRecord;
import com.questrail.filetransfer.model.ReceiveState;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements TransferObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onConnectionAccepted(InetSocketAddress remote, boolean secure) {
        events.add(remote);
    }

    @Override
    public synchronized void onStateTransition(ReceiveStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransferCompleted(TransferRecord record) {
        events.add(record);
    }

    @Override
    public synchronized void onError(TransferErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ReceiveState> visitedStates() {
        return events.stream()
            .filter(e -> e instanceof ReceiveStateTransitionEvent)
            .map(e -> ((ReceiveStateTransitionEvent) e).newState())
            .collect(Collectors.toList());
    }

    public synchronized List<TransferErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof TransferErrorEvent)
            .map(e -> (TransferErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
