package com.tessera.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider.
 *
 * <p>A target is a long-running container with the workspace bind-mounted at
 * /workspace. Each shell session is a {@code docker exec} with a TTY attached:
 * <ul>
 *   <li>stdin is fed from a queue filled by session input</li>
 *   <li>stdout frames are pushed to the session's output sink</li>
 *   <li>resize maps to the exec resize endpoint</li>
 *   <li>INT is a Ctrl-C on the TTY; other signals go through a helper exec that
 *       finds the shell's processes by the marker variable in their environment</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String WORKSPACE_MOUNT = "/workspace";
    static final String SHELL_MARKER = "TESSERA_SHELL";

    private final DockerClient dockerClient;
    private final String image;
    private final String shell;
    private final int memoryLimitMb;

    public DockerSandboxProvider(DockerClient dockerClient, String image, String shell, int memoryLimitMb) {
        this.dockerClient = dockerClient;
        this.image = image;
        this.shell = shell;
        this.memoryLimitMb = memoryLimitMb;
    }

    @Override
    public String name() {
        return "docker";
    }

    @Override
    public boolean isAvailable(String targetId) {
        try {
            var state = dockerClient.inspectContainerCmd(targetId).exec().getState();
            return state != null && Boolean.TRUE.equals(state.getRunning());
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            log.warn("Cannot inspect container {}: {}", targetId, e.getMessage());
            return false;
        }
    }

    @Override
    public ShellChannel openShell(String targetId, TerminalSize size, OutputSink sink) {
        String marker = UUID.randomUUID().toString().substring(0, 12);
        String execId;
        try {
            execId = dockerClient.execCreateCmd(targetId)
                    .withAttachStdin(true)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withTty(true)
                    .withEnv(List.of("TERM=xterm-256color",
                            "COLUMNS=" + size.cols(), "LINES=" + size.rows(),
                            SHELL_MARKER + "=" + marker))
                    .withWorkingDir(WORKSPACE_MOUNT)
                    .withCmd(shell)
                    .exec()
                    .getId();
        } catch (NotFoundException e) {
            throw new SessionException(SessionException.Kind.TARGET_UNAVAILABLE, targetId,
                    "Container " + targetId + " not found", e);
        }

        var stdin = new QueueInputStream();
        var callback = dockerClient.execStartCmd(execId)
                .withDetach(false)
                .withTty(true)
                .withStdIn(stdin)
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        sink.onOutput(frame.getPayload());
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        log.warn("Exec {} in {} failed: {}", execId, targetId, throwable.getMessage());
                        sink.onClosed();
                        super.onError(throwable);
                    }

                    @Override
                    public void onComplete() {
                        sink.onClosed();
                        super.onComplete();
                    }
                });
        log.debug("Started exec {} ({}) in container {}", execId, shell, targetId);

        var channel = new DockerShellChannel(targetId, execId, marker, stdin, callback);
        channel.resize(size);
        return channel;
    }

    @Override
    public String createTarget(Path workspace) {
        String containerName = "tessera-sandbox-" + UUID.randomUUID().toString().substring(0, 8);
        String hostPath = workspace.toAbsolutePath().normalize().toString();
        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(hostPath, new Volume(WORKSPACE_MOUNT), AccessMode.rw))
                .withMemory((long) memoryLimitMb * 1024 * 1024);
        try {
            var response = dockerClient.createContainerCmd(image)
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withLabels(Map.of("tessera.workspace", hostPath))
                    .withWorkingDir(WORKSPACE_MOUNT)
                    .withTty(true)
                    .withCmd("sleep", "infinity")
                    .exec();
            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Sandbox container {} started ({}) for {}", containerName, containerId, hostPath);
            return containerId;
        } catch (NotFoundException e) {
            throw new IllegalStateException("Sandbox image " + image + " is not available locally; pull it first", e);
        }
    }

    @Override
    public void destroyTarget(String targetId) {
        try {
            dockerClient.stopContainerCmd(targetId).exec();
        } catch (RuntimeException e) {
            log.debug("Container {} may already be stopped: {}", targetId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(targetId).withForce(true).exec();
            log.info("Sandbox container {} removed", targetId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", targetId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove container {}", targetId, e);
        }
    }

    /** Round-trip to the daemon; throws if it cannot be reached. */
    public void ping() {
        dockerClient.pingCmd().exec();
    }

    /** Shell script that signals every process whose environment carries the marker. */
    static String signalScript(ShellSignal signal, String marker) {
        return "for p in /proc/[0-9]*; do "
                + "tr '\\0' '\\n' < \"$p/environ\" 2>/dev/null | grep -qx '" + SHELL_MARKER + "=" + marker + "' "
                + "&& kill -" + signal.name() + " \"${p#/proc/}\" 2>/dev/null; done; true";
    }

    private final class DockerShellChannel implements ShellChannel {

        private static final byte CTRL_C = 0x03;

        private final String targetId;
        private final String execId;
        private final String marker;
        private final QueueInputStream stdin;
        private final ResultCallback.Adapter<Frame> callback;
        private volatile boolean closed;

        DockerShellChannel(String targetId, String execId, String marker, QueueInputStream stdin,
                           ResultCallback.Adapter<Frame> callback) {
            this.targetId = targetId;
            this.execId = execId;
            this.marker = marker;
            this.stdin = stdin;
            this.callback = callback;
        }

        @Override
        public void signal(ShellSignal signal) throws IOException {
            if (signal == ShellSignal.INT) {
                write(new byte[]{CTRL_C});
                return;
            }
            if (closed) {
                throw new IOException("Exec " + execId + " is closed");
            }
            try {
                String helperId = dockerClient.execCreateCmd(targetId)
                        .withAttachStdout(true)
                        .withAttachStderr(true)
                        .withCmd("sh", "-c", signalScript(signal, marker))
                        .exec()
                        .getId();
                boolean done = dockerClient.execStartCmd(helperId)
                        .exec(new ResultCallback.Adapter<Frame>())
                        .awaitCompletion(5, TimeUnit.SECONDS);
                if (!done) {
                    throw new IOException("SIG" + signal.name() + " to exec " + execId + " timed out");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while signalling exec " + execId, e);
            } catch (RuntimeException e) {
                throw new IOException("Cannot signal exec " + execId + ": " + e.getMessage(), e);
            }
            log.debug("Sent SIG{} to exec {} in {}", signal.name(), execId, targetId);
        }

        @Override
        public void write(byte[] data) throws IOException {
            if (closed) {
                throw new IOException("Exec " + execId + " is closed");
            }
            stdin.offer(data);
        }

        @Override
        public void resize(TerminalSize size) {
            try {
                dockerClient.resizeExecCmd(execId).withSize(size.rows(), size.cols()).exec();
            } catch (RuntimeException e) {
                log.debug("Resize of exec {} ignored: {}", execId, e.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return !closed && !stdin.isClosed();
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            stdin.close();
            try {
                callback.close();
            } catch (IOException e) {
                log.debug("Closing attach stream of exec {} failed: {}", execId, e.getMessage());
            }
        }
    }
}
