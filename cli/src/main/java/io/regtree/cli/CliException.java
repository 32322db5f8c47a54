package io.regtree.cli;

/** Usage or input problem reported to the user; exits with status 1. */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }
}
