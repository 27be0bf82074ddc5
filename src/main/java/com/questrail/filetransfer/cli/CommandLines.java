package com.questrail.filetransfer.cli;

/**
 * Shared argument helpers; every problem is an {@link IllegalArgumentException}.
 */
final class CommandLines {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private CommandLines() {}

    static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    static int port(String raw) {
        int port = integer("port", raw);
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + raw);
        }
        return port;
    }

    static int positiveInt(String option, String raw) {
        int value = integer(option, raw);
        if (value < 1) {
            throw new IllegalArgumentException(option + " must be >= 1: " + raw);
        }
        return value;
    }

    private static int integer(String what, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " is not a number: " + raw, e);
        }
    }
}
