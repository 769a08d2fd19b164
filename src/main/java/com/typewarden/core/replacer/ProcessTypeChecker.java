package com.typewarden.core.replacer;

import com.typewarden.core.config.CampaignProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the configured type checker command as a bounded-time subprocess.
 * <p>
 * Output is drained on a separate thread so a chatty compiler cannot block on
 * a full pipe while we wait. A run that exceeds the timeout is destroyed and
 * reported as {@link TypeCheckResult#timedOut}.
 */
@Component
public class ProcessTypeChecker implements TypeChecker {

    private static final Logger log = LoggerFactory.getLogger(ProcessTypeChecker.class);

    private final List<String> command;
    private final Path workingDirectory;
    private final Duration timeout;

    @Autowired
    public ProcessTypeChecker(CampaignProperties properties) {
        this(properties.getTypeChecker().getCommand(),
                Path.of(properties.getTypeChecker().getWorkingDirectory()),
                Duration.ofSeconds(properties.getTypeChecker().getTimeoutSeconds()));
    }

    public ProcessTypeChecker(List<String> command, Path workingDirectory, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalStateException("typewarden.type-checker.command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
    }

    @Override
    public TypeCheckResult check() {
        long start = System.nanoTime();
        log.debug("Running type checker: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.error("Type checker could not be started: {}", String.join(" ", command), e);
            return TypeCheckResult.failedToStart(e.getMessage(), elapsedSince(start));
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                log.warn("Type checker timed out after {}s", timeout.toSeconds());
                return TypeCheckResult.timedOut(collect(output), elapsedSince(start));
            }
            int exitCode = process.exitValue();
            String text = collect(output);
            log.debug("Type checker exited with code {} in {}ms", exitCode, elapsedSince(start).toMillis());
            return new TypeCheckResult(exitCode, text, false, elapsedSince(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RuntimeException("Interrupted while waiting for the type checker", e);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    public List<String> getCommand() {
        return command;
    }

    private static String drain(Process process) {
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not collect type checker output: {}", e.getMessage());
            return "";
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
