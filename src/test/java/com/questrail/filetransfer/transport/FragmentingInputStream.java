package com.questrail.filetransfer.transport;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * FragmentingInputStream
 * -----------------------------------------------------------------------------
 * Test-only stream that never returns more than {@code maxFragment} bytes per
 * read, imitating a socket that delivers data in small pieces.
 *
 * <p>It also counts read calls and reports how many bytes remain unread, so
 * tests can check that a reader consumed exactly what it declared.</p>
 */
public final class FragmentingInputStream extends InputStream {

    private final byte[] data;
    private final int maxFragment;
    private int position;
    private int reads;

    public FragmentingInputStream(byte[] data, int maxFragment) {
        this.data = Objects.requireNonNull(data, "data").clone();
        if (maxFragment < 1) {
            throw new IllegalArgumentException("maxFragment must be >= 1");
        }
        this.maxFragment = maxFragment;
    }

    @Override
    public int read() {
        reads++;
        return position < data.length ? data[position++] & 0xFF : -1;
    }

    @Override
    public int read(byte[] b, int off, int len) {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        reads++;
        if (position >= data.length) {
            return -1;
        }
        int n = Math.min(Math.min(len, maxFragment), data.length - position);
        System.arraycopy(data, position, b, off, n);
        position += n;
        return n;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public int readCalls() {
        return reads;
    }

    public int unread() {
        return data.length - position;
    }

    public byte[] consumed() {
        return Arrays.copyOf(data, position);
    }
}
