package com.questrail.filetransfer.transport;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * FakeStreamConnection
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamConnection} implementation.
 *
 * <p>This fake preserves the transport seam used by the receiver. It contains
 * no protocol logic; it replays scripted inbound bytes and captures anything
 * written outbound.</p>
 */
public final class FakeStreamConnection implements StreamConnection {

    private final InputStream input;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final InetSocketAddress remote;
    private boolean closed;

    public FakeStreamConnection(InputStream input, InetSocketAddress remote) {
        this.input = Objects.requireNonNull(input, "input");
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    public static FakeStreamConnection replaying(byte[] inbound, int maxFragment) {
        return new FakeStreamConnection(new FragmentingInputStream(inbound, maxFragment),
            new InetSocketAddress("127.0.0.1", 40000));
    }

    @Override
    public InputStream input() {
        return input;
    }

    @Override
    public OutputStream output() {
        return output;
    }

    @Override
    public InetSocketAddress remoteAddress() {
        return remote;
    }

    @Override
    public boolean secure() {
        return false;
    }

    @Override
    public void close() {
        closed = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public byte[] written() {
        return output.toByteArray();
    }

    public boolean isClosed() {
        return closed;
    }
}
