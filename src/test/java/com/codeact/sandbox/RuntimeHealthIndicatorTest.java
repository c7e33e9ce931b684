package com.codeact.sandbox;

import com.codeact.core.model.RuntimeKind;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PingCmd;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RuntimeHealthIndicatorTest {

    private static Path executable(Path dir, String name) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("reports UP when every interpreter resolves on the search path")
    void allInterpretersFound(@TempDir Path bin) throws Exception {
        executable(bin, "python3");
        executable(bin, "Rscript");
        executable(bin, "bash");

        var indicator = new RuntimeHealthIndicator(new ExecutionProperties(), null, bin.toString());
        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(bin.resolve("python3").toString(), health.getDetails().get(RuntimeKind.GENERAL_PURPOSE.tag()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("reports DEGRADED and names the missing interpreter")
    void missingInterpreter(@TempDir Path bin) throws Exception {
        executable(bin, "python3");
        executable(bin, "bash");

        var indicator = new RuntimeHealthIndicator(new ExecutionProperties(), null, bin.toString());
        var health = indicator.health();

        assertEquals(RuntimeHealthIndicator.DEGRADED, health.getStatus().getCode());
        assertEquals("missing: Rscript", health.getDetails().get(RuntimeKind.STATISTICAL.tag()));
    }

    @Test
    @DisplayName("an unconfigured runtime is reported")
    void unconfiguredRuntime() {
        var properties = new ExecutionProperties();
        properties.setInterpreters(Map.of(RuntimeKind.SHELL.tag(), List.of("sh")));

        var health = new RuntimeHealthIndicator(properties, null, "").health();

        assertEquals("not configured", health.getDetails().get(RuntimeKind.GENERAL_PURPOSE.tag()));
    }

    @Test
    @DisplayName("pings the Docker daemon when the docker provider is selected")
    void dockerProvider() {
        var properties = new ExecutionProperties();
        properties.setProvider("docker");
        var dockerClient = mock(DockerClient.class);
        var pingCmd = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(pingCmd);

        assertEquals(Status.UP, new RuntimeHealthIndicator(properties, dockerClient, "").health().getStatus());

        when(pingCmd.exec()).thenThrow(new RuntimeException("connection refused"));
        assertEquals(Status.DOWN, new RuntimeHealthIndicator(properties, dockerClient, "").health().getStatus());
    }
}
