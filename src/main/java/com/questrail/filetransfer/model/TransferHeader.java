package com.questrail.filetransfer.model;

import java.util.Objects;

/**
 * TransferHeader
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of the header that precedes every payload.
 *
 * <h2>Unsigned size</h2>
 * The wire carries the payload size as an unsigned 64-bit integer. It is held
 * here in a {@code long} whose bit pattern is the wire value; callers must use
 * {@link Long#compareUnsigned(long, long)} and {@link Long#toUnsignedString(long)}
 * when comparing or printing it. A negative {@code fileSize} therefore means a
 * size of at least 2^63 bytes, not an error.
 *
 * @param filename name as sent by the peer (never null, may be empty)
 * @param fileSize declared payload length, unsigned
 */
public record TransferHeader(String filename, long fileSize)
{
    public TransferHeader {
        Objects.requireNonNull(filename, "filename");
    }

    @Override
    public String toString() {
        return "TransferHeader[" +
                "filename=" + filename +
                ", fileSize=" + Long.toUnsignedString(fileSize) +
                ']';
    }
}
