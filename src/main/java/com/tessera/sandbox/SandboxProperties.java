package com.tessera.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tessera")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getImage() { return sandbox.image; }
    public String getShell() { return sandbox.shell; }
    public String getDockerHost() { return sandbox.dockerHost; }
    public int getOutputBufferChunks() { return sandbox.outputBufferChunks; }
    public int getOutputRetentionSeconds() { return sandbox.outputRetentionSeconds; }
    public int getOutputStallMillis() { return sandbox.outputStallMillis; }
    public int getIdleTimeoutSeconds() { return sandbox.idleTimeoutSeconds; }
    public int getReapIntervalSeconds() { return sandbox.reapIntervalSeconds; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        /** "local" runs a host shell, "docker" a shell inside a container. */
        private String provider = "local";
        private String image = "debian:bookworm-slim";
        private String shell = "/bin/sh";
        /** Overrides DOCKER_HOST when set. */
        private String dockerHost = "";
        private int outputBufferChunks = 1024;
        private int outputRetentionSeconds = 30;
        private int outputStallMillis = 2000;
        private int idleTimeoutSeconds = 900;
        private int reapIntervalSeconds = 30;
        private int memoryLimitMb = 2048;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public int getOutputBufferChunks() { return outputBufferChunks; }
        public void setOutputBufferChunks(int outputBufferChunks) { this.outputBufferChunks = outputBufferChunks; }
        public int getOutputRetentionSeconds() { return outputRetentionSeconds; }
        public void setOutputRetentionSeconds(int outputRetentionSeconds) { this.outputRetentionSeconds = outputRetentionSeconds; }
        public int getOutputStallMillis() { return outputStallMillis; }
        public void setOutputStallMillis(int outputStallMillis) { this.outputStallMillis = outputStallMillis; }
        public int getIdleTimeoutSeconds() { return idleTimeoutSeconds; }
        public void setIdleTimeoutSeconds(int idleTimeoutSeconds) { this.idleTimeoutSeconds = idleTimeoutSeconds; }
        public int getReapIntervalSeconds() { return reapIntervalSeconds; }
        public void setReapIntervalSeconds(int reapIntervalSeconds) { this.reapIntervalSeconds = reapIntervalSeconds; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    }
}
