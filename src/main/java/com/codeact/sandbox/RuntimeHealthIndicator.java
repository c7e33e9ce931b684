package com.codeact.sandbox;

import com.codeact.core.model.RuntimeKind;
import com.github.dockerjava.api.DockerClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Actuator health indicator for the execution runtimes.
 * <p>
 * With the process harness, every runtime's interpreter must resolve on {@code PATH};
 * missing ones turn the status to DEGRADED. With the Docker harness the daemon is pinged.
 */
@Component("runtimeHealthIndicator")
public class RuntimeHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ExecutionProperties properties;
    private final DockerClient dockerClient;
    private final String searchPath;

    @Autowired
    public RuntimeHealthIndicator(ExecutionProperties properties,
                                  @Autowired(required = false) DockerClient dockerClient) {
        this(properties, dockerClient, System.getenv("PATH"));
    }

    RuntimeHealthIndicator(ExecutionProperties properties, DockerClient dockerClient, String searchPath) {
        this.properties = properties;
        this.dockerClient = dockerClient;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    @Override
    public Health health() {
        if ("docker".equals(properties.getProvider())) {
            return dockerHealth();
        }
        var builder = Health.up().withDetail("provider", "process");
        boolean anyMissing = false;
        for (RuntimeKind runtime : RuntimeKind.values()) {
            String executable;
            try {
                executable = properties.interpreterFor(runtime).get(0);
            } catch (RuntimeLaunchException e) {
                builder.withDetail(runtime.tag(), "not configured");
                anyMissing = true;
                continue;
            }
            Optional<Path> resolved = resolve(executable);
            if (resolved.isPresent()) {
                builder.withDetail(runtime.tag(), resolved.get().toString());
            } else {
                builder.withDetail(runtime.tag(), "missing: " + executable);
                anyMissing = true;
            }
        }
        return anyMissing ? builder.status(DEGRADED).build() : builder.build();
    }

    private Health dockerHealth() {
        if (dockerClient == null) {
            return Health.down().withDetail("provider", "docker").withDetail("reason", "no Docker client").build();
        }
        try {
            dockerClient.pingCmd().exec();
            return Health.up()
                    .withDetail("provider", "docker")
                    .withDetail("host", properties.getDocker().getHost())
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("provider", "docker").build();
        }
    }

    Optional<Path> resolve(String executable) {
        return Executables.resolve(executable, searchPath);
    }
}
