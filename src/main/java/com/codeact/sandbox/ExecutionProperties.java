package com.codeact.sandbox;

import com.codeact.core.model.RuntimeKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the execution harness, bound from {@code codeact.execution.*}.
 * Runtime-keyed maps use the runtime tags ({@code general-purpose}, {@code statistical},
 * {@code shell}).
 */
@Component
@ConfigurationProperties(prefix = "codeact.execution")
public class ExecutionProperties {

    private String provider = "process";
    private int timeoutSeconds = 600;
    private int maxOutputChars = 10_000;
    private Map<String, List<String>> interpreters = new HashMap<>(Map.of(
            RuntimeKind.GENERAL_PURPOSE.tag(), List.of("python3"),
            RuntimeKind.STATISTICAL.tag(), List.of("Rscript"),
            RuntimeKind.SHELL.tag(), List.of("bash")));
    private Docker docker = new Docker();

    /**
     * Interpreter command for a runtime; the script path is appended as the last argument.
     *
     * @throws RuntimeLaunchException if no command is configured for the runtime
     */
    public List<String> interpreterFor(RuntimeKind runtime) {
        List<String> command = interpreters.get(runtime.tag());
        if (command == null || command.isEmpty()) {
            throw new RuntimeLaunchException(runtime, "No interpreter configured for runtime " + runtime.tag(), null);
        }
        return command;
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getMaxOutputChars() { return maxOutputChars; }
    public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    public Map<String, List<String>> getInterpreters() { return interpreters; }
    public void setInterpreters(Map<String, List<String>> interpreters) { this.interpreters = interpreters; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }

    public static class Docker {
        private String host = "unix:///var/run/docker.sock";
        private Map<String, String> images = new HashMap<>(Map.of(
                RuntimeKind.GENERAL_PURPOSE.tag(), "python:3.11-slim",
                RuntimeKind.STATISTICAL.tag(), "r-base:4.3.2",
                RuntimeKind.SHELL.tag(), "bash:5.2"));
        private int memoryLimitMb = 2048;
        private int cpuCount = 1;
        private String networkMode = "none";

        public String imageFor(RuntimeKind runtime) {
            String image = images.get(runtime.tag());
            if (image == null || image.isBlank()) {
                throw new IllegalStateException("No container image configured for runtime " + runtime.tag());
            }
            return image;
        }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public Map<String, String> getImages() { return images; }
        public void setImages(Map<String, String> images) { this.images = images; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public String getNetworkMode() { return networkMode; }
        public void setNetworkMode(String networkMode) { this.networkMode = networkMode; }
    }
}
