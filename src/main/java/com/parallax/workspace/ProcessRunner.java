package com.parallax.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command in a directory, optionally feeding stdin, and captures its
 * combined output. A command that outlives its timeout is destroyed.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    public record Result(int exitCode, String output, boolean timedOut) {
        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    public Result run(List<String> command, Path workDir, String stdin, Duration timeout)
            throws IOException, InterruptedException {
        log.debug("Running: {} in {}", String.join(" ", command), workDir);

        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();

        // Drain output concurrently so a chatty process never blocks on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("Process closed stdin early: {}", e.getMessage());
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting, destroying: {}", command.get(0));
            destroyTree(process);
            throw e;
        }
        if (!finished) {
            log.warn("Command timed out after {}s, destroying: {}", timeout.toSeconds(), command.get(0));
            destroyTree(process);
            process.waitFor(5, TimeUnit.SECONDS);
            return new Result(-1, collect(output), true);
        }
        return new Result(process.exitValue(), collect(output), false);
    }

    /** Kills the process and everything it spawned, children first. */
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            log.debug("Could not collect process output: {}", e.getMessage());
            return "";
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Process output stream closed: {}", e.getMessage());
            return "";
        }
    }

    /** Splits a configured command line on whitespace. */
    public static List<String> split(String commandLine) {
        return List.of(commandLine.trim().split("\\s+"));
    }
}
