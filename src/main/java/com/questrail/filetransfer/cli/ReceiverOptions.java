package com.questrail.filetransfer.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed receiver command line.
 *
 * <pre>
 *   [--host ADDR] &lt;port&gt; [--cert PEM --key PEM] [--receive-dir DIR] [--metrics-file CSV] [--chunk-size N]
 * </pre>
 *
 * A certificate/key pair switches the receiver to TLS. The default bind
 * address is all interfaces.
 */
record ReceiverOptions(
    String host,
    int port,
    Optional<Path> certificate,
    Optional<Path> privateKey,
    Optional<Path> receiveDirectory,
    Optional<Path> metricsFile,
    Optional<Integer> chunkSize
) {
    static final String DEFAULT_HOST = "0.0.0.0";

    static final String USAGE =
        "usage: receiver [--host 0.0.0.0] <port> [--cert cert.pem --key key.pem]"
            + " [--receive-dir DIR] [--metrics-file FILE.csv] [--chunk-size N]";

    boolean secure() {
        return certificate.isPresent();
    }

    static ReceiverOptions parse(String[] args) {
        List<String> positional = new ArrayList<>();
        String host = DEFAULT_HOST;
        Path cert = null;
        Path key = null;
        Path dir = null;
        Path metrics = null;
        Integer chunk = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--host" -> host = CommandLines.value(args, ++i, a);
                case "--cert" -> cert = Path.of(CommandLines.value(args, ++i, a));
                case "--key" -> key = Path.of(CommandLines.value(args, ++i, a));
                case "--receive-dir" -> dir = Path.of(CommandLines.value(args, ++i, a));
                case "--metrics-file" -> metrics = Path.of(CommandLines.value(args, ++i, a));
                case "--chunk-size" -> chunk = CommandLines.positiveInt(a, CommandLines.value(args, ++i, a));
                default -> {
                    if (a.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option " + a);
                    }
                    positional.add(a);
                }
            }
        }

        if (positional.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one <port>");
        }
        if ((cert == null) != (key == null)) {
            throw new IllegalArgumentException("--cert and --key must be given together");
        }
        return new ReceiverOptions(
            host,
            CommandLines.port(positional.get(0)),
            Optional.ofNullable(cert),
            Optional.ofNullable(key),
            Optional.ofNullable(dir),
            Optional.ofNullable(metrics),
            Optional.ofNullable(chunk));
    }
}
