package com.webdoc.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on one launched subprocess.
 *
 * <p>Stdout is read by a daemon thread into an append-only line queue that the caller
 * drains with {@link #nextLine()}; stderr is buffered (capped) for diagnostics. Timeout and
 * cancellation terminate the process from the runner's scheduler, which closes the stream and
 * ends the line sequence, so a caller blocked on the next line is released without polling
 * anything else.
 *
 * <p>Exactly one {@link ProcessOutcome} is produced per invocation; {@link #awaitOutcome()}
 * returns the cached value on every call after the first.
 */
public final class RunningProcess {

    private static final Logger log = LoggerFactory.getLogger(RunningProcess.class);

    /** Queue sentinel marking end of stdout; compared by identity. */
    private static final String END_OF_STREAM = new String("<end-of-stream>");

    private final String name;
    private final Process process;
    private final ScheduledExecutorService scheduler;
    private final Duration gracePeriod;
    private final long startNanos;
    private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
    private final StringBuilder stderr = new StringBuilder();
    private final int stderrMaxChars;
    private final AtomicReference<OutcomeStatus> forcedStatus = new AtomicReference<>();
    private final CompletableFuture<ProcessOutcome> outcome = new CompletableFuture<>();

    private volatile Thread errGobbler;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile boolean endOfStream;
    private long exitSeenNanos = -1;

    RunningProcess(String name, Process process, ScheduledExecutorService scheduler,
                   Duration gracePeriod, int stderrMaxChars) {
        this.name = name;
        this.process = process;
        this.scheduler = scheduler;
        this.gracePeriod = gracePeriod;
        this.stderrMaxChars = stderrMaxChars;
        this.startNanos = System.nanoTime();
    }

    /**
     * A handle for a process that could not be started. It yields no lines and reports a
     * {@link OutcomeStatus#FAILED} outcome carrying the launch error.
     */
    static RunningProcess launchFailure(String name, String diagnostic) {
        RunningProcess failed = new RunningProcess(name, null, null, Duration.ZERO, 0);
        failed.endOfStream = true;
        failed.outcome.complete(new ProcessOutcome(OutcomeStatus.FAILED, -1, diagnostic, 0));
        return failed;
    }

    void begin(Duration timeout) {
        // Tools must never wait on interactive input
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", name, e.getMessage());
        }
        startDaemon(new LineReader(process.getInputStream()), name + "-out");
        errGobbler = startDaemon(new StderrReader(process.getErrorStream()), name + "-err");
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            timeoutTask = scheduler.schedule(() -> {
                if (terminate(OutcomeStatus.TIMED_OUT)) {
                    log.warn("Process {} exceeded timeout of {}s, terminating", name, timeout.toSeconds());
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    public String name() {
        return name;
    }

    /**
     * Blocks until the next stdout line is available or the stream has ended.
     *
     * @return the next line, or empty once the output sequence is finished
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<String> nextLine() throws InterruptedException {
        while (!endOfStream) {
            String line = lines.poll(ProcessTimeouts.LINE_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            if (line == END_OF_STREAM) {
                endOfStream = true;
                break;
            }
            if (line != null) {
                return Optional.of(line);
            }
            if (!process.isAlive()) {
                // A descendant may still hold the pipe open; stop waiting after a short drain window
                long now = System.nanoTime();
                if (exitSeenNanos < 0) {
                    exitSeenNanos = now;
                } else if (now - exitSeenNanos > ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT.toNanos()) {
                    log.debug("Output of {} still open {}ms after exit, closing sequence",
                            name, ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT.toMillis());
                    endOfStream = true;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Requests cancellation: graceful termination, then forced after the grace window.
     * Returns immediately; the outcome will be {@link OutcomeStatus#CANCELLED} unless another
     * terminal cause was recorded first.
     *
     * @return true if this call initiated termination
     */
    public boolean cancel() {
        boolean initiated = terminate(OutcomeStatus.CANCELLED);
        if (initiated) {
            log.info("Cancelling process {}", name);
        }
        return initiated;
    }

    /**
     * Waits for the process to exit and returns its outcome. Idempotent.
     *
     * @throws InterruptedException if interrupted while waiting for exit
     */
    public ProcessOutcome awaitOutcome() throws InterruptedException {
        if (outcome.isDone()) {
            return outcome.join();
        }
        int exitCode = process.waitFor();
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
        OutcomeStatus forced = forcedStatus.get();
        OutcomeStatus status = forced != null ? forced
                : exitCode == 0 ? OutcomeStatus.SUCCEEDED : OutcomeStatus.FAILED;
        String errText;
        synchronized (stderr) {
            errText = stderr.toString();
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (outcome.complete(new ProcessOutcome(status, exitCode, errText, durationMs))) {
            log.debug("Process {} finished: {} (exit {}) in {}ms", name, status, exitCode, durationMs);
        }
        return outcome.join();
    }

    /** The outcome if already determined. */
    public Optional<ProcessOutcome> outcomeIfDone() {
        return outcome.isDone() ? Optional.of(outcome.join()) : Optional.empty();
    }

    private boolean terminate(OutcomeStatus cause) {
        if (process == null || outcome.isDone() || !process.isAlive()) {
            return false;
        }
        if (!forcedStatus.compareAndSet(null, cause)) {
            return false;
        }
        scheduler.execute(this::destroyProcess);
        return true;
    }

    private void destroyProcess() {
        try {
            destroyDescendants(false);
            process.destroy();
            boolean exited = process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                log.warn("Process {} did not exit within {}ms, forcing", name, gracePeriod.toMillis());
                destroyDescendants(true);
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    log.warn("Process {} still alive after destroyForcibly", name);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while destroying process {}", name);
        } catch (RuntimeException e) {
            log.warn("Error destroying process {}: {}", name, e.toString());
        }
    }

    private void destroyDescendants(boolean forcibly) {
        try {
            process.descendants().forEach(child -> {
                if (forcibly) {
                    child.destroyForcibly();
                } else {
                    child.destroy();
                }
            });
        } catch (UnsupportedOperationException e) {
            log.debug("Process {} does not expose descendants", name);
        }
    }

    private static Thread startDaemon(Runnable task, String threadName) {
        Thread thread = new Thread(task, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
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

    /**
     * Copies stdout lines into the queue and always terminates the sequence.
     */
    private final class LineReader implements Runnable {
        private final InputStream inputStream;

        LineReader(InputStream inputStream) {
            this.inputStream = inputStream;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    lines.add(line);
                }
            } catch (IOException e) {
                log.debug("Stdout reader for {} stopped: {}", name, e.toString());
            } finally {
                lines.add(END_OF_STREAM);
            }
        }
    }

    /**
     * Buffers stderr up to the cap, then keeps draining without accumulating so the
     * process never blocks on a full pipe.
     */
    private final class StderrReader implements Runnable {
        private final InputStream inputStream;

        StderrReader(InputStream inputStream) {
            this.inputStream = inputStream;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (stderr) {
                        if (stderr.length() >= stderrMaxChars) {
                            if (!capReached) {
                                log.warn("Stderr of {} reached {} char cap; discarding further output",
                                        name, stderrMaxChars);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!stderr.isEmpty()) {
                            stderr.append('\n');
                        }
                        int available = stderrMaxChars - stderr.length();
                        stderr.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                log.debug("Stderr reader for {} stopped: {}", name, e.toString());
            }
        }
    }
}
