package com.questrail.filetransfer.metrics;

import com.questrail.filetransfer.model.TransferErrorKind;
import com.questrail.filetransfer.model.TransferException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * CsvMetricsRecorder
 * -----------------------------------------------------------------------------
 * {@link MetricsRecorder} writing one CSV line per transfer.
 *
 * <h2>Format</h2>
 * <pre>
 *   timestamp,client_ip,client_port,filename,file_size_bytes,duration_seconds,throughput_bytes_per_second
 *   2026-10-18T09:15:02,127.0.0.1,51234,report.bin,10000,0.001234,8103727.714749
 * </pre>
 *
 * <p>The header line is written exactly once, when the file does not yet
 * exist. Lines end in CRLF; fields containing a comma, quote or line break are
 * quoted with embedded quotes doubled (RFC 4180). Duration and throughput carry
 * six decimals. Offline analysis tools read this file by column name and never
 * write to it.</p>
 */
public final class CsvMetricsRecorder implements MetricsRecorder
{
    static final List<String> COLUMNS = List.of(
            "timestamp",
            "client_ip",
            "client_port",
            "filename",
            "file_size_bytes",
            "duration_seconds",
            "throughput_bytes_per_second");

    private static final String LINE_END = "\r\n";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final Path file;

    public CsvMetricsRecorder(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void append(TransferRecord record) {
        Objects.requireNonNull(record, "record");
        boolean existed = Files.exists(file);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                if (!existed) {
                    writer.write(String.join(",", COLUMNS));
                    writer.write(LINE_END);
                }
                writer.write(format(record));
                writer.write(LINE_END);
            }
        }
        catch (IOException e) {
            throw new TransferException(TransferErrorKind.IO_FAILURE,
                    "Unable to append metrics to " + file, e);
        }
    }

    static String format(TransferRecord record) {
        return String.join(",",
                TIMESTAMP.format(record.timestamp()),
                escape(record.clientAddress()),
                Integer.toString(record.clientPort()),
                escape(record.filename()),
                Long.toUnsignedString(record.fileSizeBytes()),
                String.format(Locale.ROOT, "%.6f", record.durationSeconds()),
                String.format(Locale.ROOT, "%.6f", record.throughputBytesPerSecond()));
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
