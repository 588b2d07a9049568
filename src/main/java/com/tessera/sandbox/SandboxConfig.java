package com.tessera.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "tessera.sandbox.provider", havingValue = "docker")
    public DockerClient dockerClient(SandboxProperties properties) {
        String dockerHost = properties.getDockerHost() != null && !properties.getDockerHost().isBlank()
                ? properties.getDockerHost()
                : System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "tessera.sandbox.provider", havingValue = "docker")
    public SandboxProvider dockerSandboxProvider(DockerClient dockerClient, SandboxProperties properties) {
        return new DockerSandboxProvider(dockerClient, properties.getImage(), properties.getShell(),
                properties.getMemoryLimitMb());
    }

    @Bean
    @ConditionalOnProperty(name = "tessera.sandbox.provider", havingValue = "local", matchIfMissing = true)
    public SandboxProvider localSandboxProvider(SandboxProperties properties) {
        return new LocalSandboxProvider(properties.getShell());
    }
}
