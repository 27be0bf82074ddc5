package com.questrail.filetransfer.codec;

import com.questrail.filetransfer.model.TransferHeader;

/**
 * TransferHeaderEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for the transfer header.
 *
 * <p>This interface defines the outbound boundary between a file name / size
 * pair and the bytes that must precede the payload on the wire:</p>
 *
 * <pre>
 *   [2 bytes BE uint16 nameLen] [nameLen bytes UTF-8 name] [8 bytes BE uint64 fileSize]
 * </pre>
 *
 * <p>The encoder does not open connections or stream payload bytes. It only
 * applies the mechanical layout rules.</p>
 */
public interface TransferHeaderEncoder
{
    /**
     * Encode a header into wire-ready bytes.
     *
     * <p>The name length is validated before any output is produced; an
     * over-long name yields no bytes at all.</p>
     *
     * @param filename name to announce (UTF-8 encoded on the wire)
     * @param fileSize payload length, interpreted as unsigned
     * @return the complete header
     * @throws com.questrail.filetransfer.model.TransferException with kind
     *         {@code NAME_TOO_LONG} if the encoded name exceeds 65535 bytes
     */
    byte[] encode(String filename, long fileSize);

    default byte[] encode(TransferHeader header) {
        return encode(header.filename(), header.fileSize());
    }
}
