package com.questrail.filetransfer.cli;

import com.questrail.filetransfer.config.TransferConfig;
import com.questrail.filetransfer.model.TransferException;
import com.questrail.filetransfer.observability.Slf4jTransferObservabilitySink;
import com.questrail.filetransfer.receiver.FileReceiver;
import com.questrail.filetransfer.transport.tls.SecureChannelConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;

/**
 * Command-line receiver. Runs the accept loop until the process is stopped.
 *
 * <p>Exit status: 1 if the receiver cannot start (bad TLS material, port in
 * use), 2 on a usage error.</p>
 */
public final class ReceiverMain {
    private static final Logger log = LoggerFactory.getLogger(ReceiverMain.class);

    private ReceiverMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    static int run(String[] args, PrintStream err) {
        final ReceiverOptions options;
        try {
            options = ReceiverOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(ReceiverOptions.USAGE);
            return CommandLines.EXIT_USAGE;
        }

        final FileReceiver receiver;
        try {
            receiver = FileReceiver.builder()
                .withConfig(toConfig(options))
                .withBindAddress(new InetSocketAddress(options.host(), options.port()))
                .withObservabilitySink(new Slf4jTransferObservabilitySink())
                .build();
            receiver.bind();
        } catch (TransferException | IOException e) {
            log.error("Receiver failed to start", e);
            return CommandLines.EXIT_FAILURE;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                receiver.close();
            } catch (IOException e) {
                log.warn("Error while closing receiver", e);
            }
        }, "receiver-shutdown"));

        receiver.serve();
        return CommandLines.EXIT_OK;
    }

    static TransferConfig toConfig(ReceiverOptions options) {
        TransferConfig.Builder config = TransferConfig.builder();
        if (options.secure()) {
            config.withSecureChannel(SecureChannelConfig.forServer(
                options.certificate().orElseThrow(),
                options.privateKey().orElseThrow()));
        }
        options.receiveDirectory().ifPresent(config::withReceiveDirectory);
        options.metricsFile().ifPresent(config::withMetricsFile);
        options.chunkSize().ifPresent(config::withChunkSize);
        TransferConfig built = config.build();
        log.info("Files go to {}/, metrics to {}", built.receiveDirectory(), built.metricsFile());
        return built;
    }
}
