package com.questrail.filetransfer.codec.impl;

import com.questrail.filetransfer.codec.TransferHeaderDecoder;
import com.questrail.filetransfer.model.ReceiveState;
import com.questrail.filetransfer.model.TransferHeader;

import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * DefaultTransferHeaderDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link TransferHeaderDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Exact read of the 2-byte unsigned name length</li>
 *   <li>Exact read of the name bytes</li>
 *   <li>Exact read of the 8-byte unsigned payload size</li>
 * </ol>
 *
 * <p>Name bytes are decoded as UTF-8 with malformed sequences replaced by
 * U+FFFD, so a badly encoded name never aborts the transfer at this layer.</p>
 */
public final class DefaultTransferHeaderDecoder implements TransferHeaderDecoder
{
    @Override
    public TransferHeader decode(InputStream source, Consumer<ReceiveState> stages)
    {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(stages, "stages");

        // 1) Name length
        stages.accept(ReceiveState.AWAITING_NAME_LEN);
        final byte[] rawLength = ExactReads.readExactly(source, HeaderLayout.NAME_LENGTH_BYTES);
        final int nameLength = ByteBuffer.wrap(rawLength).getShort() & 0xFFFF;

        // 2) Name
        stages.accept(ReceiveState.AWAITING_NAME);
        final byte[] rawName = ExactReads.readExactly(source, nameLength);
        final String filename = new String(rawName, StandardCharsets.UTF_8);

        // 3) Payload size (unsigned; kept as the raw bit pattern)
        stages.accept(ReceiveState.AWAITING_SIZE);
        final byte[] rawSize = ExactReads.readExactly(source, HeaderLayout.FILE_SIZE_BYTES);
        final long fileSize = ByteBuffer.wrap(rawSize).getLong();

        return new TransferHeader(filename, fileSize);
    }
}
