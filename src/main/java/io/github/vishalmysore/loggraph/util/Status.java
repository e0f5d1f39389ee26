package io.github.vishalmysore.loggraph.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of an operation that can fail on caller-supplied input, such as a
 * malformed type declaration or a label that collides with an existing one.
 * A failed status always carries a human-readable message.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Status {
    private static final Status OK = new Status(true, "");

    boolean ok;
    String message;

    public static Status ok() {
        return OK;
    }

    public static Status error(String message) {
        return new Status(false, message);
    }

    @Override
    public String toString() {
        return ok ? "OK" : "ERROR: " + message;
    }
}
