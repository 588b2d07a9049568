package com.tessera.sandbox;

import java.io.IOException;

/**
 * Live connection to an interactive shell inside a sandbox target.
 */
public interface ShellChannel extends AutoCloseable {

    void write(byte[] data) throws IOException;

    /** Delivers a signal to what the shell is running, or to the shell when it is idle. */
    void signal(ShellSignal signal) throws IOException;

    /** Advisory; providers without a terminal may ignore it. */
    void resize(TerminalSize size);

    boolean isOpen();

    @Override
    void close();
}
