/**
 * Transfer Header Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the file transfer
 * protocol: the fixed layout of the header that precedes every payload.</p>
 *
 * <h2>Wire format</h2>
 * <pre>
 *   [2 bytes BE uint16 nameLen] [nameLen bytes UTF-8 name] [8 bytes BE uint64 fileSize] [fileSize bytes payload]
 * </pre>
 *
 * <p>There is no trailer, no checksum and no end marker. The receiver knows the
 * payload is complete only because it has consumed exactly {@code fileSize}
 * bytes.</p>
 *
 * <h2>Architectural placement</h2>
 * <pre>
 *   sender:    (filename, size) → TransferHeaderEncoder → byte[] → stream
 *   receiver:  stream → TransferHeaderDecoder (exact reads) → TransferHeader
 * </pre>
 *
 * <p>The codec is transport-agnostic: it works on {@link java.io.InputStream}
 * and {@code byte[]} only and is identical for plain and TLS connections.</p>
 */
package com.questrail.filetransfer.codec;
