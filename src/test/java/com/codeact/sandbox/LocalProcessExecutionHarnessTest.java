package com.codeact.sandbox;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.model.ExecutionRequest;
import com.codeact.core.model.ExecutionResult;
import com.codeact.core.model.RuntimeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs real shell snippets through {@link LocalProcessExecutionHarness}.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class LocalProcessExecutionHarnessTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private ExecutionProperties properties;
    private LocalProcessExecutionHarness harness;

    @BeforeEach
    void setUp() {
        properties = new ExecutionProperties();
        properties.setInterpreters(Map.of(
                RuntimeKind.GENERAL_PURPOSE.tag(), List.of("python3"),
                RuntimeKind.STATISTICAL.tag(), List.of("Rscript"),
                RuntimeKind.SHELL.tag(), List.of("sh")));
        harness = new LocalProcessExecutionHarness(properties);
    }

    private ExecutionRequest shell(String source, Duration timeout, Path workDir) {
        return new ExecutionRequest(RuntimeKind.SHELL, source, timeout, workDir);
    }

    @Nested
    @DisplayName("Normal execution")
    class NormalExecution {

        @Test
        @DisplayName("captures stdout and a zero exit status")
        void capturesStdout() {
            ExecutionResult result = harness.execute(shell("echo hello", TIMEOUT, null), CancellationToken.none());

            assertEquals("hello\n", result.stdout());
            assertEquals("", result.stderr());
            assertEquals(0, result.exitStatus());
            assertTrue(result.succeeded());
            assertFalse(result.timedOut());
            assertFalse(result.killed());
        }

        @Test
        @DisplayName("reports non-zero exit status and stderr")
        void reportsFailure() {
            ExecutionResult result = harness.execute(
                    shell("echo oops 1>&2\nexit 3", TIMEOUT, null), CancellationToken.none());

            assertEquals(3, result.exitStatus());
            assertEquals("oops\n", result.stderr());
            assertFalse(result.killed());
            assertFalse(result.succeeded());
        }

        @Test
        @DisplayName("files written in a pinned directory are visible to later snippets")
        void pinnedDirectoryPersists(@TempDir Path workDir) {
            harness.execute(shell("echo 42 > state.txt", TIMEOUT, workDir), CancellationToken.none());
            ExecutionResult result = harness.execute(shell("cat state.txt", TIMEOUT, workDir), CancellationToken.none());

            assertEquals("42\n", result.stdout());
            assertTrue(Files.exists(workDir.resolve("state.txt")));
        }

        @Test
        @DisplayName("runs in the working directory it was given")
        void runsInWorkingDirectory(@TempDir Path workDir) throws Exception {
            ExecutionResult result = harness.execute(shell("pwd", TIMEOUT, workDir), CancellationToken.none());

            assertEquals(workDir.toRealPath().toString(), Path.of(result.stdout().strip()).toRealPath().toString());
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("kills a snippet that exceeds its timeout within a small margin")
        void timesOut() {
            long start = System.nanoTime();
            ExecutionResult result = harness.execute(
                    shell("echo started\nsleep 30\necho never", Duration.ofSeconds(1), null), CancellationToken.none());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(result.timedOut());
            assertTrue(result.killed());
            assertEquals(ExecutionResult.KILLED_EXIT_STATUS, result.exitStatus());
            assertTrue(result.stdout().contains("started"));
            assertFalse(result.stdout().contains("never"));
            assertTrue(elapsedMs < 5_000, "took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("background processes do not outlive the snippet")
        void reclaimsBackgroundChildren(@TempDir Path workDir) throws Exception {
            assumeTrue(Executables.resolve("setsid", System.getenv("PATH")).isPresent(), "setsid not installed");

            long start = System.nanoTime();
            ExecutionResult result = harness.execute(
                    shell("sleep 30 &\necho $! > child.pid\necho parent done", TIMEOUT, workDir), CancellationToken.none());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(0, result.exitStatus());
            assertEquals("parent done\n", result.stdout());
            assertTrue(elapsedMs < 1_500, "took " + elapsedMs + "ms");
            long childPid = Long.parseLong(Files.readString(workDir.resolve("child.pid")).strip());
            long deadline = System.currentTimeMillis() + 2_000;
            while (ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false)
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(50);
            }
            assertFalse(ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false));
        }

        @Test
        @DisplayName("caps captured output and marks it truncated")
        void truncatesOutput() {
            properties.setMaxOutputChars(100);

            ExecutionResult result = harness.execute(
                    shell("i=0; while [ $i -lt 200 ]; do echo line-$i; i=$((i+1)); done", TIMEOUT, null),
                    CancellationToken.none());

            assertTrue(result.outputTruncated());
            assertTrue(result.stdout().startsWith("line-0\n"));
            assertTrue(result.stdout().contains("output truncated"));
            assertEquals(0, result.exitStatus());
        }
    }

    @Nested
    @DisplayName("Failures and cancellation")
    class FailuresAndCancellation {

        @Test
        @DisplayName("a missing interpreter raises RuntimeLaunchException")
        void missingInterpreter() {
            properties.setInterpreters(Map.of(RuntimeKind.STATISTICAL.tag(), List.of("definitely-not-an-interpreter-xyz")));

            var request = new ExecutionRequest(RuntimeKind.STATISTICAL, "1+1", TIMEOUT, null);
            var e = assertThrows(RuntimeLaunchException.class,
                    () -> harness.execute(request, CancellationToken.none()));
            assertEquals(RuntimeKind.STATISTICAL, e.runtime());
        }

        @Test
        @DisplayName("a working directory that cannot hold the snippet raises SnippetSetupException")
        void damagedWorkingDirectory(@TempDir Path workDir) throws Exception {
            Files.writeString(workDir.resolve(SnippetFiles.SNIPPET_DIR), "not a directory");

            var e = assertThrows(SnippetSetupException.class,
                    () -> harness.execute(shell("echo hi", TIMEOUT, workDir), CancellationToken.none()));
            assertEquals(RuntimeKind.SHELL, e.runtime());
            assertTrue(e.getMessage().contains("Could not write the snippet"));
        }

        @Test
        @DisplayName("an unconfigured runtime raises RuntimeLaunchException")
        void unconfiguredRuntime() {
            properties.setInterpreters(Map.of(RuntimeKind.SHELL.tag(), List.of("sh")));

            var request = new ExecutionRequest(RuntimeKind.GENERAL_PURPOSE, "print(1)", TIMEOUT, null);
            assertThrows(RuntimeLaunchException.class, () -> harness.execute(request, CancellationToken.none()));
        }

        @Test
        @DisplayName("a token cancelled up front prevents the launch")
        void cancelledBeforeStart() {
            var token = new CancellationToken();
            token.cancel();

            assertThrows(TaskCancelledException.class,
                    () -> harness.execute(shell("echo hi", TIMEOUT, null), token));
        }

        @Test
        @DisplayName("cancelling the token kills a running snippet")
        void cancelKillsSnippet() throws Exception {
            var token = new CancellationToken();
            var future = CompletableFuture.supplyAsync(
                    () -> harness.execute(shell("sleep 30", TIMEOUT, null), token));

            Thread.sleep(500);
            token.cancel();
            ExecutionResult result = future.get(10, TimeUnit.SECONDS);

            assertTrue(result.killed());
            assertFalse(result.timedOut());
            assertEquals(ExecutionResult.KILLED_EXIT_STATUS, result.exitStatus());
        }

        @Test
        @DisplayName("scratch directories are removed after the run")
        void scratchDirectoryRemoved() {
            ExecutionResult result = harness.execute(shell("pwd", TIMEOUT, null), CancellationToken.none());

            assertFalse(Files.exists(Path.of(result.stdout().strip())));
        }
    }
}
