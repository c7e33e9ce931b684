package com.codeact.sandbox;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.model.ExecutionRequest;
import com.codeact.core.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs snippets as child processes of this JVM.
 *
 * <p>Each invocation:
 * <ul>
 *   <li>writes the source to a script file in the working directory</li>
 *   <li>starts the interpreter configured for the runtime with the script as its last argument</li>
 *   <li>drains stdout and stderr on background threads into capped buffers</li>
 *   <li>waits up to the timeout, then kills the whole process tree</li>
 * </ul>
 * Where {@code setsid} is available the interpreter leads its own process group, and the
 * group is killed after every run so backgrounded children do not outlive the snippet.
 * Without a pinned working directory a scratch directory is created and removed per call.
 */
public class LocalProcessExecutionHarness implements ExecutionHarness {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutionHarness.class);

    private static final long REAP_TIMEOUT_MS = 5_000;
    private static final long DRAIN_TIMEOUT_MS = 2_000;
    private static final long GROUP_KILL_TIMEOUT_MS = 2_000;

    private final ExecutionProperties properties;
    private final String searchPath;
    private final Optional<Path> setsid;

    public LocalProcessExecutionHarness(ExecutionProperties properties) {
        this(properties, System.getenv("PATH"));
    }

    LocalProcessExecutionHarness(ExecutionProperties properties, String searchPath) {
        this.properties = properties;
        this.searchPath = searchPath;
        this.setsid = Executables.resolve("setsid", searchPath);
        if (setsid.isEmpty()) {
            log.info("setsid not found; background processes started by snippets are not reclaimed");
        }
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request, CancellationToken token) {
        token.throwIfCancelled();
        boolean scratch = request.workingDirectory() == null;
        Path workDir = scratch
                ? SnippetFiles.scratchDirectory(request.runtime())
                : request.workingDirectory();
        try {
            Path script = workDir.resolve(SnippetFiles.write(workDir, request));
            return run(request, workDir, script, token);
        } finally {
            if (scratch) {
                ScratchDirectories.delete(workDir);
            }
        }
    }

    private ExecutionResult run(ExecutionRequest request, Path workDir, Path script, CancellationToken token) {
        var command = new ArrayList<>(properties.interpreterFor(request.runtime()));
        command.add(script.toAbsolutePath().toString());
        String interpreter = command.get(0);
        boolean ownGroup = setsid.isPresent();
        if (ownGroup) {
            // setsid would report a missing interpreter as exit status 127
            if (Executables.resolve(interpreter, searchPath).isEmpty()) {
                throw new RuntimeLaunchException(request.runtime(),
                        "Could not launch " + request.runtime().tag() + " runtime (" + interpreter
                                + "): not found on PATH", null);
            }
            command.add(0, setsid.get().toString());
        }

        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.warn("Could not launch {} runtime with {}: {}", request.runtime().tag(), command, e.getMessage());
            throw new RuntimeLaunchException(request.runtime(),
                    "Could not launch " + request.runtime().tag() + " runtime (" + interpreter + "): "
                            + e.getMessage(), e);
        }
        log.debug("Started {} snippet as pid {} (timeout {}s)",
                request.runtime().tag(), process.pid(), request.timeout().toSeconds());

        var stdout = new OutputBuffer(properties.getMaxOutputChars());
        var stderr = new OutputBuffer(properties.getMaxOutputChars());
        List<Thread> drains = List.of(
                drain(process.getInputStream(), stdout, "exec-stdout-" + process.pid()),
                drain(process.getErrorStream(), stderr, "exec-stderr-" + process.pid()));

        var cancelled = new AtomicBoolean(false);
        CancellationToken.Registration registration = token.onCancel(() -> {
            cancelled.set(true);
            destroyTree(process);
        });

        boolean timedOut = false;
        try {
            boolean exited = process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                timedOut = !cancelled.get();
                log.info("Snippet pid {} exceeded {}s timeout, killing process tree",
                        process.pid(), request.timeout().toSeconds());
                destroyTree(process);
            }
            process.waitFor(REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            cancelled.set(true);
        } finally {
            registration.remove();
            if (ownGroup) {
                killGroup(process.pid());
            }
        }
        joinDrains(drains);

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        boolean killed = timedOut || cancelled.get();
        int exitStatus = killed ? ExecutionResult.KILLED_EXIT_STATUS : exitValueOf(process);
        return new ExecutionResult(
                stdout.toString(),
                stderr.toString(),
                exitStatus,
                durationMs,
                timedOut,
                killed,
                stdout.truncated() || stderr.truncated());
    }

    /**
     * Kills descendants before the root so no grandchild keeps the output pipes open.
     */
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Kills every process left in the group led by {@code pid}. An empty group is not an error.
     */
    private static void killGroup(long pid) {
        try {
            Process kill = new ProcessBuilder("kill", "-KILL", "--", "-" + pid)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!kill.waitFor(GROUP_KILL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                kill.destroyForcibly();
                log.warn("Timed out killing process group {}", pid);
            } else if (kill.exitValue() == 0) {
                log.debug("Killed leftover processes in group {}", pid);
            }
        } catch (IOException e) {
            log.warn("Could not kill process group {}: {}", pid, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static int exitValueOf(Process process) {
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            log.warn("Process {} did not terminate after being reaped", process.pid());
            return ExecutionResult.KILLED_EXIT_STATUS;
        }
    }

    private static Thread drain(InputStream stream, OutputBuffer buffer, String name) {
        Thread thread = new Thread(() -> {
            char[] chunk = new char[4096];
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int read;
                while ((read = reader.read(chunk)) != -1) {
                    buffer.append(chunk, 0, read);
                }
            } catch (IOException e) {
                log.debug("Output stream {} closed: {}", name, e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinDrains(List<Thread> drains) {
        for (Thread drain : drains) {
            try {
                drain.join(DRAIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
