package com.codeact.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the execution harness from {@code codeact.execution.provider}:
 * {@code process} (default) or {@code docker}.
 */
@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    @Bean
    @ConditionalOnProperty(name = "codeact.execution.provider", havingValue = "process", matchIfMissing = true)
    public ExecutionHarness localProcessExecutionHarness(ExecutionProperties properties) {
        log.info("Using local process execution harness (timeout {}s)", properties.getTimeoutSeconds());
        return new LocalProcessExecutionHarness(properties);
    }

    @Bean
    @ConditionalOnProperty(name = "codeact.execution.provider", havingValue = "docker")
    public DockerClient dockerClient(ExecutionProperties properties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getDocker().getHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "codeact.execution.provider", havingValue = "docker")
    public ExecutionHarness dockerExecutionHarness(DockerClient dockerClient, ExecutionProperties properties) {
        log.info("Using Docker execution harness (timeout {}s)", properties.getTimeoutSeconds());
        return new DockerExecutionHarness(dockerClient, properties);
    }
}
