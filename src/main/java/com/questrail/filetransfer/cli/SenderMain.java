package com.questrail.filetransfer.cli;

import com.questrail.filetransfer.config.TransferConfig;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.sender.FileSender;
import com.questrail.filetransfer.sender.TransferResult;
import com.questrail.filetransfer.transport.tls.SecureChannelConfig;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Command-line sender.
 *
 * <p>Exit status: 0 when every repetition was sent, 1 on the first transfer
 * error, 2 on a usage error.</p>
 */
public final class SenderMain {

    private SenderMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final SenderOptions options;
        try {
            options = SenderOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(SenderOptions.USAGE);
            return CommandLines.EXIT_USAGE;
        }

        TransferConfig.Builder config = TransferConfig.builder();
        options.trustAnchor().ifPresent(anchor -> config.withSecureChannel(SecureChannelConfig.forClient(anchor)));
        options.chunkSize().ifPresent(config::withChunkSize);

        final FileSender sender;
        try {
            sender = new FileSender(config.build());
        } catch (TransferException e) {
            err.println("Unable to initialise TLS: " + e.getMessage());
            return CommandLines.EXIT_FAILURE;
        }

        String mode = sender.secure() ? "(TLS) " : "";
        for (int i = 1; i <= options.repeat(); i++) {
            out.printf("=== %sTransfer %d/%d ===%n", mode, i, options.repeat());
            TransferResult result = sender.send(options.host(), options.port(), options.file());
            if (!result.isSuccess()) {
                err.printf("%sTransfer %d failed (%s): %s%n", mode, i,
                    result.errorKind().orElseThrow(), result.detail());
                return CommandLines.EXIT_FAILURE;
            }
            out.printf(Locale.ROOT, "%sSent '%s' (%d bytes); client-side time %.6f s%n%n",
                mode, result.filename(), result.bytesSent(), result.duration().toNanos() / 1_000_000_000.0);
        }
        return CommandLines.EXIT_OK;
    }
}
