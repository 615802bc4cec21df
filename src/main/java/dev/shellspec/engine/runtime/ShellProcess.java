package dev.shellspec.engine.runtime;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches Bash with a clean startup: no profile or rc files, no {@code BASH_ENV}, no exported host
 * functions, stdin closed. Output of both streams is collected in order by a helper thread.
 */
public final class ShellProcess {
    private static final Logger log = LoggerFactory.getLogger(ShellProcess.class);
    private static final Duration DRAIN_GRACE = Duration.ofSeconds(2);

    private final String shell;

    public ShellProcess(String shell) {
        this.shell = Objects.requireNonNull(shell, "shell");
    }

    public String shell() {
        return shell;
    }

    public ProcessOutcome run(List<String> arguments, Path workingDirectory, Optional<Duration> timeout) {
        List<String> command = new ArrayList<>();
        command.add(shell);
        command.add("--noprofile");
        command.add("--norc");
        command.addAll(arguments);
        log.debug("Running {} in {}", command, workingDirectory);

        var builder = new ProcessBuilder(command)
            .directory(workingDirectory.toFile())
            .redirectErrorStream(true);
        scrubEnvironment(builder.environment());

        long started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to start " + shell + ": " + ex.getMessage(), ex);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException ex) {
            log.debug("Unable to close stdin of {}: {}", shell, ex.getMessage());
        }

        var collector = new OutputCollector(process.getInputStream());
        var drain = new Thread(collector, "shellspec-output");
        drain.setDaemon(true);
        drain.start();

        boolean timedOut = false;
        try {
            if (timeout.isPresent()) {
                if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    timedOut = true;
                    process.descendants().forEach(ProcessHandle::destroyForcibly);
                    process.destroyForcibly();
                    process.waitFor();
                }
            } else {
                process.waitFor();
            }
            drain.join(DRAIN_GRACE.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted while waiting for " + shell, ex);
        }
        if (drain.isAlive()) {
            log.debug("Output of {} still open after exit (background job?); using what was collected", shell);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        int exitCode = timedOut ? ProcessOutcome.TIMEOUT_EXIT_CODE : process.exitValue();
        return new ProcessOutcome(collector.text(), exitCode, elapsed, timedOut);
    }

    static void scrubEnvironment(Map<String, String> environment) {
        environment.remove("BASH_ENV");
        environment.remove("ENV");
        environment.keySet().removeIf(key -> key.startsWith("BASH_FUNC_"));
    }

    private static final class OutputCollector implements Runnable {
        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        OutputCollector(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (stream) {
                int read;
                while ((read = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, read);
                    }
                }
            } catch (IOException ex) {
                log.debug("Output stream closed early: {}", ex.getMessage());
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
