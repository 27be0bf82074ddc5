package com.questrail.filetransfer.model;

/**
 * Per-connection receive phase.
 *
 * <pre>
 *   IDLE → AWAITING_NAME_LEN → AWAITING_NAME → AWAITING_SIZE → RECEIVING_PAYLOAD → COMPLETE
 * </pre>
 *
 * Any failure from a state other than {@link #IDLE} moves the connection to
 * {@link #FAILED}. Both {@link #COMPLETE} and {@link #FAILED} are terminal; the
 * next accepted connection starts again at {@link #IDLE}.
 */
public enum ReceiveState
{
    IDLE,
    AWAITING_NAME_LEN,
    AWAITING_NAME,
    AWAITING_SIZE,
    RECEIVING_PAYLOAD,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
