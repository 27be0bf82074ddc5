package com.questrail.filetransfer.codec.impl;

import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * ExactReads
 * -----------------------------------------------------------------------------
 * Exact-length reads over a stream that may deliver partial data.
 *
 * <p>A stream read may return fewer bytes than requested at any time. Every
 * read in this protocol instead needs <em>precisely</em> a known count, so these
 * helpers keep pulling from the source until that count has accumulated. If the
 * source reports end-of-stream first, the read fails with
 * {@link TransferErrorKind#INCOMPLETE_STREAM}; a short result is never
 * returned.</p>
 *
 * <p>An {@link IOException} raised by the source (connection reset, TLS record
 * failure) is treated the same way: the peer did not deliver the declared
 * bytes.</p>
 */
public final class ExactReads
{
    private ExactReads() {}

    /**
     * Read exactly {@code count} bytes into a new array.
     */
    public static byte[] readExactly(InputStream source, int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        final byte[] out = new byte[count];
        readExactly(source, out, 0, count);
        return out;
    }

    /**
     * Fill {@code buffer[offset, offset + length)} from {@code source}.
     *
     * <p>On failure the contents of that range are unspecified and must not be
     * used.</p>
     */
    public static void readExactly(InputStream source, byte[] buffer, int offset, int length)
    {
        Objects.requireNonNull(source, "source");
        Objects.checkFromIndexSize(offset, length, buffer.length);

        int filled = 0;
        while (filled < length) {
            final int n;
            try {
                n = source.read(buffer, offset + filled, length - filled);
            }
            catch (IOException e) {
                throw new TransferException(TransferErrorKind.INCOMPLETE_STREAM,
                        "Stream failed after " + filled + " of " + length + " bytes", e);
            }
            if (n < 0) {
                throw new TransferException(TransferErrorKind.INCOMPLETE_STREAM,
                        "Stream closed after " + filled + " of " + length + " bytes");
            }
            filled += n;
        }
    }
}
