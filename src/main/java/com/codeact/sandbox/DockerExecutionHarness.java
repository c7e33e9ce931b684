package com.codeact.sandbox;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.model.ExecutionRequest;
import com.codeact.core.model.ExecutionResult;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs each snippet in a throwaway Docker container.
 *
 * <p>The working directory is bind-mounted at {@value #CONTAINER_WORKDIR}, the snippet
 * is written there and run with the runtime's interpreter. The container is killed when
 * the timeout elapses or the task is cancelled, and always removed afterwards.
 */
public class DockerExecutionHarness implements ExecutionHarness {

    private static final Logger log = LoggerFactory.getLogger(DockerExecutionHarness.class);

    static final String CONTAINER_WORKDIR = "/workspace";
    private static final long LOG_TIMEOUT_SECONDS = 30;

    private final DockerClient dockerClient;
    private final ExecutionProperties properties;

    public DockerExecutionHarness(DockerClient dockerClient, ExecutionProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request, CancellationToken token) {
        token.throwIfCancelled();
        boolean scratch = request.workingDirectory() == null;
        Path workDir = scratch
                ? SnippetFiles.scratchDirectory(request.runtime())
                : request.workingDirectory();
        try {
            Path script = SnippetFiles.write(workDir, request);
            String containerId = openContainer(request, workDir, script);
            try {
                return awaitResult(request, containerId, token);
            } finally {
                removeContainer(containerId);
            }
        } finally {
            if (scratch) {
                ScratchDirectories.delete(workDir);
            }
        }
    }

    private String openContainer(ExecutionRequest request, Path workDir, Path script) {
        var docker = properties.getDocker();
        String image = docker.imageFor(request.runtime());

        var command = new ArrayList<>(properties.interpreterFor(request.runtime()));
        command.add(CONTAINER_WORKDIR + "/" + script.toString().replace('\\', '/'));

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(workDir.toAbsolutePath().toString(), new Volume(CONTAINER_WORKDIR), AccessMode.rw))
                .withMemory((long) docker.getMemoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) docker.getCpuCount())
                .withNetworkMode(docker.getNetworkMode());

        try {
            var response = dockerClient.createContainerCmd(image)
                    .withHostConfig(hostConfig)
                    .withWorkingDir(CONTAINER_WORKDIR)
                    .withCmd(command)
                    .exec();
            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.debug("Started {} snippet in container {} (image {})", request.runtime().tag(), containerId, image);
            return containerId;
        } catch (RuntimeException e) {
            log.warn("Could not start container for {} runtime (image {}): {}",
                    request.runtime().tag(), image, e.getMessage());
            throw new RuntimeLaunchException(request.runtime(),
                    "Could not start " + request.runtime().tag() + " container from image " + image
                            + ": " + e.getMessage(), e);
        }
    }

    private ExecutionResult awaitResult(ExecutionRequest request, String containerId, CancellationToken token) {
        long start = System.nanoTime();
        var cancelled = new AtomicBoolean(false);
        boolean timedOut = false;
        Integer statusCode = null;

        try (CancellationToken.Registration ignored = token.onCancel(() -> {
            cancelled.set(true);
            killContainer(containerId);
        })) {
            statusCode = dockerClient.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback())
                    .awaitStatusCode(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (DockerClientException e) {
            timedOut = !cancelled.get();
            log.info("Container {} exceeded {}s timeout, killing it", containerId, request.timeout().toSeconds());
            killContainer(containerId);
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        boolean killed = timedOut || cancelled.get();
        var stdout = new OutputBuffer(properties.getMaxOutputChars());
        var stderr = new OutputBuffer(properties.getMaxOutputChars());
        captureLogs(containerId, stdout, stderr);

        int exitStatus = killed || statusCode == null ? ExecutionResult.KILLED_EXIT_STATUS : statusCode;
        return new ExecutionResult(
                stdout.toString(),
                stderr.toString(),
                exitStatus,
                durationMs,
                timedOut,
                killed,
                stdout.truncated() || stderr.truncated());
    }

    private void captureLogs(String containerId, OutputBuffer stdout, OutputBuffer stderr) {
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(text);
                            } else {
                                stdout.append(text);
                            }
                        }
                    }).awaitCompletion(LOG_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from container {}", containerId);
        }
    }

    private void killContainer(String containerId) {
        try {
            dockerClient.killContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            log.debug("Container {} may already have exited: {}", containerId, e.getMessage());
        }
    }

    private void removeContainer(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (RuntimeException e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }
}
