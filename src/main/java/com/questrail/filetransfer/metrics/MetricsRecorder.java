package com.questrail.filetransfer.metrics;

/**
 * Append-only sink for completed-transfer records.
 *
 * <p>The receiver calls {@link #append(TransferRecord)} from a single thread.
 * Implementations that may be shared by concurrent receivers must serialize
 * their writes.</p>
 */
public interface MetricsRecorder
{
    /**
     * Persist one record.
     *
     * @throws com.questrail.filetransfer.model.TransferException with kind
     *         {@code IO_FAILURE} if the store cannot be written
     */
    void append(TransferRecord record);
}
