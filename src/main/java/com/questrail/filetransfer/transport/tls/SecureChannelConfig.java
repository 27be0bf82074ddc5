package com.questrail.filetransfer.transport.tls;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * All TLS material and policy for one side of a secure channel.
 *
 * <p>The client needs {@code trustAnchor} (a PEM certificate that the server's
 * chain must validate against). The server needs {@code certificateChain} and
 * {@code privateKey} (PEM; the key in unencrypted PKCS#8 form). The reduced
 * host-name policy is recorded here, and only here, so it can be audited.</p>
 */
public record SecureChannelConfig(
    Optional<Path> trustAnchor,
    Optional<Path> certificateChain,
    Optional<Path> privateKey,
    HostnameVerification hostnameVerification
) {
    public SecureChannelConfig {
        Objects.requireNonNull(trustAnchor, "trustAnchor");
        Objects.requireNonNull(certificateChain, "certificateChain");
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(hostnameVerification, "hostnameVerification");
        if (certificateChain.isPresent() != privateKey.isPresent()) {
            throw new IllegalArgumentException("certificateChain and privateKey must be given together");
        }
    }

    public static SecureChannelConfig forClient(Path trustAnchor) {
        return builder().withTrustAnchor(trustAnchor).build();
    }

    public static SecureChannelConfig forServer(Path certificateChain, Path privateKey) {
        return builder().withServerIdentity(certificateChain, privateKey).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path trustAnchor;
        private Path certificateChain;
        private Path privateKey;
        private HostnameVerification hostnameVerification = HostnameVerification.DISABLED;

        public Builder withTrustAnchor(Path trustAnchor) {
            this.trustAnchor = Objects.requireNonNull(trustAnchor, "trustAnchor");
            return this;
        }

        public Builder withServerIdentity(Path certificateChain, Path privateKey) {
            this.certificateChain = Objects.requireNonNull(certificateChain, "certificateChain");
            this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
            return this;
        }

        public Builder withHostnameVerification(HostnameVerification policy) {
            this.hostnameVerification = policy;
            return this;
        }

        public SecureChannelConfig build() {
            return new SecureChannelConfig(
                Optional.ofNullable(trustAnchor),
                Optional.ofNullable(certificateChain),
                Optional.ofNullable(privateKey),
                hostnameVerification);
        }
    }
}
