package com.questrail.filetransfer.observability;

import com.questrail.filetransfer.model.ReceiveState;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing one step of a connection's receive state machine.
 */
public record ReceiveStateTransitionEvent(
    Instant timestamp,
    InetSocketAddress remote,
    ReceiveState oldState,
    ReceiveState newState
) {
    public boolean isTerminal() {
        return newState.isTerminal();
    }
}
