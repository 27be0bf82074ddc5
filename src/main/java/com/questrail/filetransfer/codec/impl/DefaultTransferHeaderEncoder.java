package com.questrail.filetransfer.codec.impl;

import com.questrail.filetransfer.codec.TransferHeaderEncoder;
import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultTransferHeaderEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link TransferHeaderEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultTransferHeaderDecoder}.</p>
 */
public final class DefaultTransferHeaderEncoder implements TransferHeaderEncoder
{
    @Override
    public byte[] encode(String filename, long fileSize)
    {
        Objects.requireNonNull(filename, "filename");

        final byte[] name = filename.getBytes(StandardCharsets.UTF_8);

        // The prefix describes encoded bytes, not characters.
        if (name.length > HeaderLayout.MAX_NAME_BYTES) {
            throw new TransferException(TransferErrorKind.NAME_TOO_LONG,
                    "File name encodes to " + name.length + " bytes (max "
                            + HeaderLayout.MAX_NAME_BYTES + ")");
        }

        return ByteBuffer
                .allocate(HeaderLayout.NAME_LENGTH_BYTES + name.length + HeaderLayout.FILE_SIZE_BYTES)
                .putShort((short) name.length)
                .put(name)
                .putLong(fileSize)
                .array();
    }
}
