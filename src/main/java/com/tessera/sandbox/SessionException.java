package com.tessera.sandbox;

/**
 * Failure of a sandbox session operation.
 */
public class SessionException extends RuntimeException {

    public enum Kind {
        /** The sandbox target cannot be reached or a shell cannot be started in it. */
        TARGET_UNAVAILABLE,
        /** No live session has the given id. */
        NOT_FOUND,
        /** Writing to the shell failed; the session has been closed. */
        IO_FAILURE
    }

    private final Kind kind;
    private final String id;

    public SessionException(Kind kind, String id, String message) {
        super(message);
        this.kind = kind;
        this.id = id;
    }

    public SessionException(Kind kind, String id, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.id = id;
    }

    public Kind getKind() {
        return kind;
    }

    /** Session id for NOT_FOUND and IO_FAILURE, target id for TARGET_UNAVAILABLE. */
    public String getId() {
        return id;
    }
}
