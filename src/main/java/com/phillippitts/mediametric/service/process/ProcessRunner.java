package com.phillippitts.mediametric.service.process;

import com.phillippitts.mediametric.exception.ExternalProcessException;
import com.phillippitts.mediametric.exception.ExternalProcessExceptionBuilder;
import com.phillippitts.mediametric.util.ProcessTimeouts;
import com.phillippitts.mediametric.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool to completion.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently, capped to a byte budget
 * - Enforce a timeout and terminate runaway processes
 * - Destroy the process when the calling thread is interrupted (stage abort)
 * - Report failures as {@link ExternalProcessException} with exit code, duration and stderr
 *
 * <p>Instances hold no per-call state and may be shared between workers.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    /**
     * Maximum stderr characters copied into an exception message.
     */
    static final int ERROR_SNIPPET_MAX_CHARS = 2000;

    private final ProcessFactory processFactory;

    /**
     * Captured outcome of a successful run.
     *
     * @param exitCode   process exit code (always 0 when returned)
     * @param stdout     captured standard output, possibly truncated
     * @param stderr     captured standard error, possibly truncated
     * @param durationMs wall-clock duration
     */
    public record ProcessOutcome(int exitCode, String stdout, String stderr, long durationMs) {}

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs {@code command} and waits for it to exit.
     *
     * @param command     argv, executable first
     * @param tool        short tool name used in diagnostics
     * @param timeout     maximum run time
     * @param maxCapture  byte cap for each captured stream
     * @return outcome of a zero-exit run
     * @throws ExternalProcessException on timeout, non-zero exit, start failure or interruption
     */
    public ProcessOutcome run(List<String> command, String tool, Duration timeout, int maxCapture) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = start(command, tool, maxCapture);
            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw error("Timeout after " + timeout.toSeconds() + "s", tool, -1, exec.stderr(), startTime,
                        command, null);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, tool, exitCode, exec.stderr(), startTime, command, null);
            }
            long durationMs = TimeUtils.elapsedMillis(startTime);
            LOG.debug("{} finished in {} ms", tool, durationMs);
            return new ProcessOutcome(exitCode, exec.stdout().toString(), exec.stderr().toString(), durationMs);
        } catch (IOException e) {
            throw error("I/O failure: " + e.getMessage(), tool, -1, null, startTime, command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw error("Interrupted", tool, -1, exec == null ? null : exec.stderr(), startTime, command, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution start(List<String> command, String tool, int maxCapture) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, null);
        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread out = startGobbler(process.getInputStream(), stdout, tool + "-out", maxCapture);
        Thread err = startGobbler(process.getErrorStream(), stderr, tool + "-err", maxCapture);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a sink until the cap is reached, then keeps draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.debug("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        // Clear the interrupt flag for the duration of shutdown so waitFor can block
        boolean interrupted = Thread.interrupted();
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            LOG.warn("Interrupted while destroying process");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ExternalProcessException error(String msg, String tool, int exitCode, StringBuilder stderr,
                                                  long startNano, List<String> command, Throwable cause) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        ExternalProcessExceptionBuilder builder = ExternalProcessExceptionBuilder.create(msg)
                .tool(tool)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("command", String.join(" ", command))
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
