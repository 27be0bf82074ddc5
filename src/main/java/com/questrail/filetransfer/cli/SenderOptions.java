package com.questrail.filetransfer.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed sender command line.
 *
 * <pre>
 *   &lt;host&gt; &lt;port&gt; &lt;file&gt; [--repeat N] [--trust-anchor PEM] [--chunk-size N]
 * </pre>
 *
 * A trust anchor switches the sender to TLS.
 */
record SenderOptions(
    String host,
    int port,
    Path file,
    int repeat,
    Optional<Path> trustAnchor,
    Optional<Integer> chunkSize
) {
    static final String USAGE =
        "usage: sender <host> <port> <file> [--repeat N] [--trust-anchor cert.pem] [--chunk-size N]";

    static SenderOptions parse(String[] args) {
        List<String> positional = new ArrayList<>();
        int repeat = 1;
        Path anchor = null;
        Integer chunk = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--repeat" -> repeat = CommandLines.positiveInt(a, CommandLines.value(args, ++i, a));
                case "--trust-anchor" -> anchor = Path.of(CommandLines.value(args, ++i, a));
                case "--chunk-size" -> chunk = CommandLines.positiveInt(a, CommandLines.value(args, ++i, a));
                default -> {
                    if (a.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option " + a);
                    }
                    positional.add(a);
                }
            }
        }

        if (positional.size() != 3) {
            throw new IllegalArgumentException("Expected <host> <port> <file>");
        }
        return new SenderOptions(
            positional.get(0),
            CommandLines.port(positional.get(1)),
            Path.of(positional.get(2)),
            repeat,
            Optional.ofNullable(anchor),
            Optional.ofNullable(chunk));
    }
}
