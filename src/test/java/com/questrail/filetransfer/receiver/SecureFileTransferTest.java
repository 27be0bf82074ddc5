package com.questrail.filetransfer.receiver;

import com.questrail.filetransfer.config.TransferConfig;
import com.questrail.filetransfer.metrics.TransferRecord;
import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.observability.RecordingObservabilitySink;
import com.questrail.filetransfer.sender.FileSender;
import com.questrail.filetransfer.sender.TransferResult;
import com.questrail.filetransfer.transport.tls.SecureChannelConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SecureFileTransferTest
 * -----------------------------------------------------------------------------
 * End-to-end tests with TLS on both sides, using the self-signed fixtures in
 * {@code src/test/resources/tls}.
 */
final class SecureFileTransferTest
{
    @TempDir
    Path dir;

    private Path serverCert;
    private Path serverKey;
    private Path otherCert;

    private Path receiveDir;
    private Path metricsFile;
    private RecordingObservabilitySink sink;
    private FileReceiver receiver;
    private InetSocketAddress address;
    private ExecutorService executor;

    private Path fixture(String name) throws URISyntaxException {
        return Path.of(getClass().getResource("/tls/" + name).toURI());
    }

    @BeforeEach
    void setUp() throws Exception {
        serverCert = fixture("server-cert.pem");
        serverKey = fixture("server-key.pem");
        otherCert = fixture("other-cert.pem");

        receiveDir = dir.resolve("received_tls");
        metricsFile = dir.resolve("metrics_tls.csv");
        sink = new RecordingObservabilitySink();
        receiver = FileReceiver.builder()
            .withConfig(TransferConfig.builder()
                .withSecureChannel(SecureChannelConfig.forServer(serverCert, serverKey))
                .withReceiveDirectory(receiveDir)
                .withMetricsFile(metricsFile)
                .build())
            .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
            .withObservabilitySink(sink)
            .build();
        address = receiver.bind();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws IOException {
        receiver.close();
        executor.shutdownNow();
    }

    private FileSender senderTrusting(Path anchor) {
        return new FileSender(TransferConfig.tlsDefaults(SecureChannelConfig.forClient(anchor)));
    }

    @Test
    void fileArrivesIntactOverTls() throws Exception {
        byte[] content = new byte[20000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i * 7);
        }
        Path source = Files.write(dir.resolve("secret.bin"), content);
        Future<ConnectionOutcome> outcome = executor.submit(receiver::acceptOne);

        TransferResult result = senderTrusting(serverCert).send("127.0.0.1", address.getPort(), source);

        assertTrue(result.isSuccess(), result.detail());
        assertTrue(outcome.get(10, TimeUnit.SECONDS).isComplete());
        assertArrayEquals(content, Files.readAllBytes(receiveDir.resolve("secret.bin")));

        var lines = Files.readAllLines(metricsFile, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).contains(",secret.bin,20000,"));
    }

    @Test
    void connectingByLiteralAddressSucceeds() throws Exception {
        Path source = Files.write(dir.resolve("by-ip.txt"), "x".getBytes(StandardCharsets.UTF_8));
        Future<ConnectionOutcome> outcome = executor.submit(receiver::acceptOne);

        assertTrue(senderTrusting(serverCert).send(
            address.getAddress().getHostAddress(), address.getPort(), source).isSuccess());
        assertTrue(outcome.get(10, TimeUnit.SECONDS).isComplete());
    }

    @Test
    void untrustedServerCertificateFailsBeforeAnyFileIsWritten() throws Exception {
        Path source = Files.write(dir.resolve("never.txt"), "nope".getBytes(StandardCharsets.UTF_8));
        Future<ConnectionOutcome> outcome = executor.submit(receiver::acceptOne);

        TransferResult result = senderTrusting(otherCert).send("127.0.0.1", address.getPort(), source);

        assertEquals(TransferErrorKind.HANDSHAKE_FAILURE, result.errorKind().orElseThrow());
        ConnectionOutcome serverSide = outcome.get(10, TimeUnit.SECONDS);
        assertEquals(TransferErrorKind.HANDSHAKE_FAILURE, serverSide.errorKind().orElseThrow());
        assertFalse(Files.exists(receiveDir.resolve("never.txt")));
        assertFalse(Files.exists(metricsFile));
        assertFalse(sink.hasEventOfType(TransferRecord.class));
    }

    @Test
    void plainClientIsRejectedAndServerKeepsServing() throws Exception {
        Future<?> loop = executor.submit(receiver::serve);

        try (Socket plain = new Socket(address.getAddress(), address.getPort())) {
            OutputStream out = plain.getOutputStream();
            out.write(new byte[] { 0x00, 0x05, 'p', 'l', 'a', 'i', 'n', 0, 0, 0, 0, 0, 0, 0, 1, 'x' });
            out.flush();
            plain.getInputStream().read();
        }
        catch (IOException expected) {
            // the receiver may reset the connection after the failed handshake
        }

        Path source = Files.write(dir.resolve("after.txt"), "ok".getBytes(StandardCharsets.UTF_8));
        assertTrue(senderTrusting(serverCert).send("127.0.0.1", address.getPort(), source).isSuccess());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!sink.hasEventOfType(TransferRecord.class)) {
            assertTrue(System.nanoTime() < deadline, "timed out waiting for the TLS transfer");
            Thread.sleep(10);
        }
        receiver.close();
        loop.get(10, TimeUnit.SECONDS);

        assertEquals(TransferErrorKind.HANDSHAKE_FAILURE, sink.getErrors().get(0).kind());
        assertFalse(Files.exists(receiveDir.resolve("plain")));
        assertEquals("ok", Files.readString(receiveDir.resolve("after.txt"), StandardCharsets.UTF_8));
    }

    @Test
    void missingTrustAnchorFailsAtConstruction() {
        Path missing = dir.resolve("absent.pem");

        TransferException e = assertThrows(TransferException.class, () -> senderTrusting(missing));
        assertEquals(TransferErrorKind.HANDSHAKE_FAILURE, e.kind());
    }

    @Test
    void unreadableServerKeyFailsAtBuild() throws IOException {
        Path garbage = Files.writeString(dir.resolve("garbage.pem"), "not a key");

        assertThrows(TransferException.class, () -> FileReceiver.builder()
            .withConfig(TransferConfig.tlsDefaults(SecureChannelConfig.forServer(serverCert, garbage)))
            .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
            .build());
    }
}
