package com.questrail.filetransfer.model;

/**
 * Classification of every failure a transfer can end in.
 *
 * <p>Sender-side kinds abort the whole run. Receiver-side kinds end the
 * current connection only; the accept loop continues.</p>
 */
public enum TransferErrorKind
{
    /** Sender pre-flight: the source path is not a readable regular file. */
    FILE_NOT_FOUND,

    /** Sender: the file name encodes to more than 65535 UTF-8 bytes. */
    NAME_TOO_LONG,

    /** Sender: the TCP connection to the receiver could not be opened. */
    CONNECTION_FAILED,

    /** Either side: the peer closed the stream before a declared byte count arrived. */
    INCOMPLETE_STREAM,

    /** Secure mode: TLS negotiation or certificate validation failed. */
    HANDSHAKE_FAILURE,

    /** Receiver: the client-supplied name would resolve outside the receive directory. */
    UNSAFE_FILENAME,

    /** Local disk fault while reading the source or writing the destination/metrics. */
    IO_FAILURE
}
