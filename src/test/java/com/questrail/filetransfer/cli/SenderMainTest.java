package com.questrail.filetransfer.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class SenderMainTest
{
    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return SenderMain.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static int unusedPort() throws Exception {
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return probe.getLocalPort();
        }
    }

    @Test
    void usageErrorExitsWithTwo() {
        assertEquals(2, run("only-host"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage: sender"));
    }

    @Test
    void missingFileExitsWithOne() throws Exception {
        assertEquals(1, run("127.0.0.1", Integer.toString(unusedPort()), dir.resolve("nope.txt").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("FILE_NOT_FOUND"));
    }

    @Test
    void firstFailureStopsTheRun() throws Exception {
        Path file = Files.writeString(dir.resolve("a.txt"), "a");

        assertEquals(1, run("127.0.0.1", Integer.toString(unusedPort()), file.toString(), "--repeat", "3"));

        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("=== Transfer 1/3 ==="));
        assertFalse(printed.contains("Transfer 2/3"));
    }

    @Test
    void unreadableTrustAnchorExitsWithOne() throws Exception {
        Path file = Files.writeString(dir.resolve("a.txt"), "a");

        assertEquals(1, run("127.0.0.1", "5001", file.toString(), "--trust-anchor", dir.resolve("none.pem").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("TLS"));
    }
}
