package com.questrail.filetransfer.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class ReceiverMainTest
{
    @TempDir
    Path dir;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return ReceiverMain.run(args, new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void usageErrorExitsWithTwo() {
        assertEquals(2, run("--cert", "only.pem", "5001"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage: receiver"));
    }

    @Test
    void portInUseExitsWithOne() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            int code = run("--host", "127.0.0.1", Integer.toString(occupied.getLocalPort()),
                "--receive-dir", dir.resolve("in").toString(),
                "--metrics-file", dir.resolve("m.csv").toString());

            assertEquals(1, code);
        }
    }

    @Test
    void unreadableCertificateExitsWithOne() {
        int code = run("--host", "127.0.0.1", "0",
            "--cert", dir.resolve("missing-cert.pem").toString(),
            "--key", dir.resolve("missing-key.pem").toString());

        assertEquals(1, code);
    }
}
