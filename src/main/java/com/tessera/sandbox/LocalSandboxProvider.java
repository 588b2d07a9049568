package com.tessera.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs shells directly on the host, in a registered directory. There is no
 * isolation; meant for development and for machines without Docker.
 */
public class LocalSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalSandboxProvider.class);

    private final String shell;
    private final Map<String, Path> targets = new ConcurrentHashMap<>();
    private final AtomicInteger counter = new AtomicInteger();

    public LocalSandboxProvider(String shell) {
        this.shell = shell;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public boolean isAvailable(String targetId) {
        Path dir = targets.get(targetId);
        return dir != null && Files.isDirectory(dir);
    }

    @Override
    public ShellChannel openShell(String targetId, TerminalSize size, OutputSink sink) {
        Path dir = targets.get(targetId);
        if (dir == null || !Files.isDirectory(dir)) {
            throw new SessionException(SessionException.Kind.TARGET_UNAVAILABLE, targetId,
                    "Unknown local sandbox target " + targetId);
        }
        var pb = new ProcessBuilder(shell)
                .directory(dir.toFile())
                .redirectErrorStream(true);
        pb.environment().put("TERM", "dumb");
        pb.environment().put("COLUMNS", String.valueOf(size.cols()));
        pb.environment().put("LINES", String.valueOf(size.rows()));

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SessionException(SessionException.Kind.TARGET_UNAVAILABLE, targetId,
                    "Cannot start " + shell + ": " + e.getMessage(), e);
        }
        log.debug("Started {} (pid {}) in {}", shell, process.pid(), dir);

        Thread reader = new Thread(() -> pump(process.getInputStream(), sink), "tessera-local-shell-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        return new LocalShellChannel(process);
    }

    @Override
    public String createTarget(Path workspace) {
        Path dir = workspace.toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Not a directory: " + dir);
        }
        String targetId = "local-" + counter.incrementAndGet();
        targets.put(targetId, dir);
        return targetId;
    }

    @Override
    public void destroyTarget(String targetId) {
        targets.remove(targetId);
    }

    private static void pump(InputStream in, OutputSink sink) {
        byte[] buffer = new byte[4096];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                if (n > 0) {
                    sink.onOutput(Arrays.copyOf(buffer, n));
                }
            }
        } catch (IOException e) {
            log.debug("Local shell output ended: {}", e.getMessage());
        } finally {
            sink.onClosed();
        }
    }

    /** The JDK only offers TERM and KILL; other signals go through kill(1). */
    static void kill(ShellSignal signal, List<ProcessHandle> targets) throws IOException {
        var command = new ArrayList<String>();
        command.add("kill");
        command.add("-" + signal.name());
        targets.forEach(p -> command.add(String.valueOf(p.pid())));
        Process kill = new ProcessBuilder(command).redirectErrorStream(true).start();
        try {
            if (!kill.waitFor(5, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                throw new IOException("kill -" + signal.name() + " did not finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending SIG" + signal.name(), e);
        }
        if (kill.exitValue() != 0) {
            // a target may have exited in the meantime
            log.debug("kill -{} {} exited with {}", signal.name(), command.subList(2, command.size()), kill.exitValue());
        }
    }

    private static final class LocalShellChannel implements ShellChannel {

        private final Process process;
        private final OutputStream stdin;

        LocalShellChannel(Process process) {
            this.process = process;
            this.stdin = process.getOutputStream();
        }

        @Override
        public synchronized void write(byte[] data) throws IOException {
            stdin.write(data);
            stdin.flush();
        }

        /**
         * Signals the shell's running children. With nothing running, INT is a no-op,
         * like Ctrl-C at an idle prompt, and the other signals go to the shell itself.
         */
        @Override
        public void signal(ShellSignal signal) throws IOException {
            List<ProcessHandle> running = process.descendants().toList();
            if (running.isEmpty()) {
                if (signal == ShellSignal.INT) {
                    log.debug("SIGINT with nothing running in shell {}", process.pid());
                    return;
                }
                running = List.of(process.toHandle());
            }
            switch (signal) {
                case TERM -> running.forEach(ProcessHandle::destroy);
                case KILL -> running.forEach(ProcessHandle::destroyForcibly);
                default -> kill(signal, running);
            }
        }

        @Override
        public void resize(TerminalSize size) {
            // no terminal to resize
        }

        @Override
        public boolean isOpen() {
            return process.isAlive();
        }

        @Override
        public void close() {
            try {
                stdin.close();
            } catch (IOException e) {
                log.debug("Closing shell stdin failed: {}", e.getMessage());
            }
            process.destroy();
            try {
                if (!process.waitFor(2, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
