package com.tessera.sandbox;

/**
 * Receives raw shell output from a {@link ShellChannel}, in arrival order.
 */
public interface OutputSink {

    void onOutput(byte[] data);

    /** The shell ended or the connection to it was lost. Called at most once. */
    void onClosed();
}
