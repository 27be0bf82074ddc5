package com.questrail.filetransfer.codec;

import com.questrail.filetransfer.model.ReceiveState;
import com.questrail.filetransfer.model.TransferHeader;

import java.io.InputStream;
import java.util.function.Consumer;

/**
 * TransferHeaderDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the transfer header.
 *
 * <p>The decoder reads from a <em>stream</em> that
 * may deliver the header in arbitrary fragments. It performs three sequential
 * exact-length reads (2 bytes, N bytes, 8 bytes) and never returns a partially
 * populated header.</p>
 *
 * <p>The decoder is not responsible for:</p>
 * <ul>
 *   <li>Reading the payload</li>
 *   <li>Validating whether the announced name is safe to write to disk</li>
 *   <li>Closing the source</li>
 * </ul>
 */
public interface TransferHeaderDecoder
{
    /**
     * Decode one header from {@code source}, reporting each read phase.
     *
     * <p>{@code stages} receives {@link ReceiveState#AWAITING_NAME_LEN},
     * {@link ReceiveState#AWAITING_NAME} and {@link ReceiveState#AWAITING_SIZE},
     * in that order, each immediately before the corresponding read begins.</p>
     *
     * @throws com.questrail.filetransfer.model.TransferException with kind
     *         {@code INCOMPLETE_STREAM} if the source ends before the header does
     */
    TransferHeader decode(InputStream source, Consumer<ReceiveState> stages);

    default TransferHeader decode(InputStream source) {
        return decode(source, stage -> { });
    }
}
