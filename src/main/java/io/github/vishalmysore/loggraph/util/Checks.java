package io.github.vishalmysore.loggraph.util;

import java.util.logging.Logger;

/**
 * Guards for internal contracts. A failed check is a programming error in the
 * caller, so it is logged and surfaced as an {@link IllegalStateException}
 * rather than returned as a {@link Status}.
 */
public final class Checks {
    private static final Logger log = Logger.getLogger(Checks.class.getName());

    private Checks() {
    }

    public static void check(boolean condition, String message) {
        if (!condition) {
            fail(message);
        }
    }

    public static void checkOk(Status status) {
        if (!status.isOk()) {
            fail(status.getMessage());
        }
    }

    public static IllegalStateException fail(String message) {
        log.severe(message);
        throw new IllegalStateException(message);
    }
}
