package com.tessera.core.engine;

/**
 * A command session already has an execution queued or running.
 */
public class BusyException extends RuntimeException {

    private final String inFlightExecutionId;

    public BusyException(String inFlightExecutionId) {
        super("Execution " + inFlightExecutionId + " is still running");
        this.inFlightExecutionId = inFlightExecutionId;
    }

    public String getInFlightExecutionId() {
        return inFlightExecutionId;
    }
}
