package com.svarx.runtime;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the short OS utilities behind the power hints ({@code renice}, {@code taskset}). Each call
 * gets a hard timeout; nothing here throws, callers inspect the {@link CommandResult}.
 */
public class CommandRunner {
    private static final int MAX_OUTPUT_CHARS = 300;

    private final Duration timeout;
    private final ProcessStarter processStarter;
    private final String searchPath;

    public CommandRunner(Duration timeout) {
        this(timeout, new DefaultProcessStarter(), System.getenv("PATH"));
    }

    public CommandRunner(Duration timeout, ProcessStarter processStarter, String searchPath) {
        this.timeout = timeout;
        this.processStarter = processStarter;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    public CommandResult run(String... command) {
        List<String> argv = List.of(command);
        String program = argv.isEmpty() ? "" : argv.get(0);
        Process process;
        try {
            process = processStarter.start(argv);
        } catch (IOException e) {
            return CommandResult.notExited(program, CommandResult.Outcome.LAUNCH_FAILED, String.valueOf(e.getMessage()));
        }

        CompletableFuture<String> output = drain(process.getInputStream());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return CommandResult.notExited(program, CommandResult.Outcome.TIMED_OUT, output.join());
            }
            return CommandResult.exited(program, process.exitValue(), output.join());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.notExited(program, CommandResult.Outcome.INTERRUPTED, "");
        }
    }

    /**
     * Looks the program up on the search path without spawning anything.
     */
    public boolean isInstalled(String program) {
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                Path candidate = Path.of(dir, program);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return true;
                }
            } catch (InvalidPathException e) {
                continue;
            }
        }
        return false;
    }

    private static CompletableFuture<String> drain(InputStream inputStream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = inputStream) {
                String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
                return text.length() > MAX_OUTPUT_CHARS ? text.substring(0, MAX_OUTPUT_CHARS) : text;
            } catch (IOException e) {
                return "<output unreadable: " + e.getMessage() + ">";
            }
        });
    }

    public interface ProcessStarter {
        Process start(List<String> command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(List<String> command) throws IOException {
            return new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectInput(ProcessBuilder.Redirect.from(new File(File.separatorChar == '/' ? "/dev/null" : "NUL")))
                    .start();
        }
    }
}
