package com.github.stormino.clipper.service.process;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external tools under a hard time limit.
 * <p>
 * The calling thread waits for the process; a helper thread drains its output.
 * A process that outlives its timeout, or whose caller is interrupted, is killed
 * together with all of its descendants.
 */
@Slf4j
@Service
public class ProcessRunner {

    static final int OUTPUT_TAIL_LINES = 40;
    private static final long HEARTBEAT_MILLIS = 250;
    private static final long DRAIN_GRACE_MILLIS = 2_000;

    private final TaskExecutor outputExecutor;

    // One running process per job at a time
    private final ConcurrentHashMap<String, Process> runningProcesses = new ConcurrentHashMap<>();

    public ProcessRunner(@Qualifier("processOutputExecutor") TaskExecutor outputExecutor) {
        this.outputExecutor = outputExecutor;
    }

    /**
     * Run a process to completion or timeout.
     *
     * @param spec Process to run
     * @return Result with exit code, or a timed-out result if the process was killed
     * @throws IOException if the process cannot be started
     * @throws InterruptedException if the caller was interrupted; the process is killed first
     */
    public ProcessResult run(@NonNull ProcessSpec spec) throws IOException, InterruptedException {
        log.debug("Executing {} for job {}: {}", spec.getStage(), spec.getJobId(), String.join(" ", spec.getCommand()));

        ProcessBuilder processBuilder = new ProcessBuilder(spec.getCommand());
        processBuilder.redirectErrorStream(true);
        if (spec.getWorkingDirectory() != null) {
            processBuilder.directory(spec.getWorkingDirectory().toFile());
        }

        long startNanos = System.nanoTime();
        Process process = processBuilder.start();
        runningProcesses.put(spec.getJobId(), process);

        OutputTail tail = new OutputTail(OUTPUT_TAIL_LINES);

        try {
            CompletableFuture<Void> drain = CompletableFuture.runAsync(
                    () -> drainOutput(process, spec, tail), outputExecutor);

            boolean finished = waitForExit(process, spec, startNanos);

            if (!finished) {
                destroyTree(process);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                log.warn("{} for job {} exceeded {}s, process killed", spec.getStage(), spec.getJobId(),
                        spec.getTimeout().toSeconds());
                awaitDrain(drain, spec);
                return ProcessResult.timedOut(tail.lines(), elapsed);
            }

            awaitDrain(drain, spec);
            spec.getHeartbeat().run();

            int exitCode = process.exitValue();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (exitCode != 0) {
                log.debug("{} for job {} exited with code {}", spec.getStage(), spec.getJobId(), exitCode);
            }
            return ProcessResult.completed(exitCode, tail.lines(), elapsed);

        } catch (InterruptedException e) {
            log.debug("{} for job {} interrupted, killing process", spec.getStage(), spec.getJobId());
            destroyTree(process);
            throw e;
        } catch (RuntimeException e) {
            destroyTree(process);
            throw e;
        } finally {
            runningProcesses.remove(spec.getJobId(), process);
        }
    }

    /**
     * Kill whatever process the job is currently running.
     *
     * @return true if a live process was killed
     */
    public boolean cancel(@NonNull String jobId) {
        Process process = runningProcesses.get(jobId);
        if (process != null && process.isAlive()) {
            log.debug("Killing process and descendants for job: {}", jobId);
            destroyTree(process);
            return true;
        }
        return false;
    }

    public int getRunningProcessCount() {
        return runningProcesses.size();
    }

    private boolean waitForExit(Process process, ProcessSpec spec, long startNanos) throws InterruptedException {
        long deadline = startNanos + spec.getTimeout().toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(HEARTBEAT_MILLIS));
            if (process.waitFor(slice, TimeUnit.NANOSECONDS)) {
                return true;
            }
            spec.getHeartbeat().run();
        }
    }

    private void drainOutput(Process process, ProcessSpec spec, OutputTail tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                tail.add(line);
                try {
                    spec.getLineListener().accept(line);
                } catch (RuntimeException e) {
                    log.warn("Output listener failed for job {}: {}", spec.getJobId(), e.getMessage());
                }
            }
        } catch (IOException e) {
            // Stream closes under us when the process is killed
            log.debug("Output stream of {} for job {} closed: {}", spec.getStage(), spec.getJobId(), e.getMessage());
        }
    }

    private void awaitDrain(CompletableFuture<Void> drain, ProcessSpec spec) throws InterruptedException {
        try {
            drain.get(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A grandchild may still hold the pipe open
            log.debug("Output of {} for job {} still open after exit", spec.getStage(), spec.getJobId());
        } catch (ExecutionException e) {
            log.warn("Output drain failed for job {}: {}", spec.getJobId(), e.getCause().getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Bounded buffer of the most recent output lines.
     */
    static final class OutputTail {
        private final int capacity;
        private final Deque<String> lines;

        OutputTail(int capacity) {
            this.capacity = capacity;
            this.lines = new ArrayDeque<>(capacity);
        }

        synchronized void add(String line) {
            if (lines.size() == capacity) {
                lines.removeFirst();
            }
            lines.addLast(line);
        }

        synchronized List<String> lines() {
            return List.copyOf(new ArrayList<>(lines));
        }
    }
}
