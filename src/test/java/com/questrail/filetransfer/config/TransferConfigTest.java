package com.questrail.filetransfer.config;

import com.questrail.filetransfer.transport.tls.HostnameVerification;
import com.questrail.filetransfer.transport.tls.SecureChannelConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class TransferConfigTest
{
    @Test
    void plainDefaults() {
        TransferConfig config = TransferConfig.plainDefaults();

        assertFalse(config.secure());
        assertEquals(4096, config.chunkSize());
        assertEquals(Path.of("received"), config.receiveDirectory());
        assertEquals(Path.of("metrics_plain.csv"), config.metricsFile());
    }

    @Test
    void tlsDefaultsUseSeparateDirectoryAndMetricsFile() {
        TransferConfig config = TransferConfig.tlsDefaults(
            SecureChannelConfig.forServer(Path.of("cert.pem"), Path.of("key.pem")));

        assertTrue(config.secure());
        assertEquals(Path.of("received_tls"), config.receiveDirectory());
        assertEquals(Path.of("metrics_tls.csv"), config.metricsFile());
    }

    @Test
    void explicitPathsOverrideDefaults() {
        TransferConfig config = TransferConfig.builder()
            .withChunkSize(1)
            .withReceiveDirectory(Path.of("in"))
            .withMetricsFile(Path.of("m.csv"))
            .withSecureChannel(SecureChannelConfig.forClient(Path.of("ca.pem")))
            .build();

        assertEquals(1, config.chunkSize());
        assertEquals(Path.of("in"), config.receiveDirectory());
        assertEquals(Path.of("m.csv"), config.metricsFile());
    }

    @Test
    void chunkSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> TransferConfig.builder().withChunkSize(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> TransferConfig.builder().withChunkSize(-4096).build());
    }

    @Test
    void serverIdentityNeedsBothCertificateAndKey() {
        assertThrows(IllegalArgumentException.class, () -> new SecureChannelConfig(
            Optional.empty(), Optional.of(Path.of("cert.pem")), Optional.empty(), HostnameVerification.DISABLED));
    }

    @Test
    void hostnameVerificationIsDisabledByDefault() {
        assertEquals(HostnameVerification.DISABLED,
            SecureChannelConfig.forClient(Path.of("ca.pem")).hostnameVerification());
    }
}
