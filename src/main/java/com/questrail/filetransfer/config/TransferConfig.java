package com.questrail.filetransfer.config;

import com.questrail.filetransfer.transport.tls.SecureChannelConfig;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated, immutable configuration shared by the sender and the receiver.
 *
 * <p>Built once at process start and passed in at construction. A present
 * {@code secureChannel} switches the component into TLS mode.</p>
 */
public record TransferConfig(
    int chunkSize,
    Path receiveDirectory,
    Path metricsFile,
    Optional<SecureChannelConfig> secureChannel
) {
    public static final int DEFAULT_CHUNK_SIZE = 4096;

    public static final Path PLAIN_RECEIVE_DIRECTORY = Path.of("received");
    public static final Path PLAIN_METRICS_FILE = Path.of("metrics_plain.csv");
    public static final Path TLS_RECEIVE_DIRECTORY = Path.of("received_tls");
    public static final Path TLS_METRICS_FILE = Path.of("metrics_tls.csv");

    public TransferConfig {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0: " + chunkSize);
        }
        Objects.requireNonNull(receiveDirectory, "receiveDirectory");
        Objects.requireNonNull(metricsFile, "metricsFile");
        Objects.requireNonNull(secureChannel, "secureChannel");
    }

    public boolean secure() {
        return secureChannel.isPresent();
    }

    public static TransferConfig plainDefaults() {
        return builder().build();
    }

    public static TransferConfig tlsDefaults(SecureChannelConfig secureChannel) {
        return builder().withSecureChannel(secureChannel).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private Path receiveDirectory;
        private Path metricsFile;
        private SecureChannelConfig secureChannel;

        public Builder withChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder withReceiveDirectory(Path receiveDirectory) {
            this.receiveDirectory = receiveDirectory;
            return this;
        }

        public Builder withMetricsFile(Path metricsFile) {
            this.metricsFile = metricsFile;
            return this;
        }

        public Builder withSecureChannel(SecureChannelConfig secureChannel) {
            this.secureChannel = secureChannel;
            return this;
        }

        /**
         * Unset paths fall back to the per-mode defaults: {@code received/} and
         * {@code metrics_plain.csv} for plain TCP, {@code received_tls/} and
         * {@code metrics_tls.csv} for TLS.
         */
        public TransferConfig build() {
            boolean tls = secureChannel != null;
            return new TransferConfig(
                chunkSize,
                receiveDirectory != null ? receiveDirectory : (tls ? TLS_RECEIVE_DIRECTORY : PLAIN_RECEIVE_DIRECTORY),
                metricsFile != null ? metricsFile : (tls ? TLS_METRICS_FILE : PLAIN_METRICS_FILE),
                Optional.ofNullable(secureChannel));
        }
    }
}
