package com.svarx.runtime;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCaptureOutputForNonZeroExit() {
        List<List<String>> started = new ArrayList<>();
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(1), command -> {
            started.add(command);
            return new FakeProcess(1, true, false, "renice: failed to set priority for 42: Permission denied");
        }, "");

        CommandResult result = runner.run("renice", "-n", "0", "-p", "42");

        assertEquals(List.of(List.of("renice", "-n", "0", "-p", "42")), started);
        assertEquals(CommandResult.Outcome.EXITED, result.outcome());
        assertEquals(1, result.exitCode());
        assertFalse(result.isSuccess());
        assertEquals("renice exit=1 output=renice: failed to set priority for 42: Permission denied", result.describe());
    }

    @Test
    void shouldCapLongOutput() {
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(1),
                command -> new FakeProcess(0, true, false, "x".repeat(1000)), "");

        CommandResult result = runner.run("taskset", "-p", "42");

        assertTrue(result.isSuccess());
        assertEquals(300, result.output().length());
    }

    @Test
    void shouldMarkTimedOutAndDestroyProcess() {
        FakeProcess process = new FakeProcess(0, false, false, "");
        CommandRunner runner = new CommandRunner(Duration.ofMillis(5), command -> process, "");

        CommandResult result = runner.run("taskset", "-p", "-c", "0", "42");

        assertEquals(CommandResult.Outcome.TIMED_OUT, result.outcome());
        assertFalse(result.isSuccess());
        assertEquals("taskset timed out", result.describe());
        assertTrue(process.destroyForciblyCalled);
    }

    @Test
    void shouldMarkInterruptedAndReinterruptThread() {
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(1),
                command -> new FakeProcess(0, true, true, ""), "");

        CommandResult result = runner.run("renice", "-n", "19", "-p", "42");

        assertEquals(CommandResult.Outcome.INTERRUPTED, result.outcome());
        assertTrue(Thread.currentThread().isInterrupted());
        Thread.interrupted();
    }

    @Test
    void shouldReportLaunchFailureWithoutThrowing() {
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(1), command -> {
            throw new IOException("No such file");
        }, "");

        CommandResult result = runner.run("taskset");

        assertEquals(CommandResult.Outcome.LAUNCH_FAILED, result.outcome());
        assertEquals(-1, result.exitCode());
        assertEquals("taskset could not be started: No such file", result.describe());
    }

    @Test
    void shouldFindExecutableOnSearchPathWithoutStartingProcess() throws IOException {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        Path taskset = Files.createFile(bin.resolve("taskset"));
        assertTrue(taskset.toFile().setExecutable(true));
        Files.createFile(bin.resolve("renice"));
        List<List<String>> started = new ArrayList<>();
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(1), command -> {
            started.add(command);
            return new FakeProcess(0, true, false, "");
        }, tempDir.resolve("missing") + File.pathSeparator + bin);

        assertTrue(runner.isInstalled("taskset"));
        assertFalse(runner.isInstalled("renice"));
        assertFalse(runner.isInstalled("chrt"));
        assertTrue(started.isEmpty());
    }

    private static class FakeProcess extends Process {
        private final int exitCode;
        private final boolean waitFinished;
        private final boolean interruptedWait;
        private final InputStream output;

        private boolean destroyForciblyCalled;

        private FakeProcess(int exitCode, boolean waitFinished, boolean interruptedWait, String output) {
            this.exitCode = exitCode;
            this.waitFinished = waitFinished;
            this.interruptedWait = interruptedWait;
            this.output = new ByteArrayInputStream(output.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return output;
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (interruptedWait) {
                throw new InterruptedException("interrupted");
            }
            return waitFinished;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            // no-op
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return !waitFinished;
        }
    }
}
