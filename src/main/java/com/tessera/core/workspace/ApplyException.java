package com.tessera.core.workspace;

/**
 * A refused or failed apply/revert. The workspace is left as it was before the call.
 */
public class ApplyException extends RuntimeException {

    public enum Kind {
        INVALID_CHANGE_STATE,
        STALE_CHANGE,
        IO_FAILURE,
        ALREADY_REVERTED,
        NOT_APPLIED
    }

    private final Kind kind;
    private final String changeId;

    public ApplyException(Kind kind, String changeId, String message) {
        super(message);
        this.kind = kind;
        this.changeId = changeId;
    }

    public ApplyException(Kind kind, String changeId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.changeId = changeId;
    }

    public Kind getKind() {
        return kind;
    }

    /** The offending change or ledger id. */
    public String getChangeId() {
        return changeId;
    }
}
