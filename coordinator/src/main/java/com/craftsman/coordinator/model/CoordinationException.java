package com.craftsman.coordinator.model;

/**
 * Base failure raised inside the coordinator.
 *
 * Unchecked. Anything that escapes a behavior is converted by the router
 * into a failed Outcome with the same kind.
 */
public class CoordinationException extends RuntimeException {

    private final ErrorKind kind;

    public CoordinationException(ErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CoordinationException(ErrorKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    /** The message without the {@code [KIND]} prefix. */
    public String getDetail() {
        String msg = getMessage();
        String prefix = "[" + kind + "] ";
        return msg != null && msg.startsWith(prefix) ? msg.substring(prefix.length()) : msg;
    }
}
