package com.typewarden.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Records a recoverable git checkpoint before a campaign run.
 *
 * <p>Uncommitted changes are captured with {@code git stash create} and kept
 * reachable through {@code git stash store}, without touching the working tree.
 * A clean tree checkpoints {@code HEAD}. Outside a work tree, or without a git
 * binary, no checkpoint is taken.
 */
@Service
public class GitCheckpointService {

    private static final Logger log = LoggerFactory.getLogger(GitCheckpointService.class);

    private final String gitExecutable;

    public GitCheckpointService() {
        this("git");
    }

    GitCheckpointService(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    record GitOutput(int exitCode, String output) {
        boolean ok() {
            return exitCode == 0;
        }
    }

    /**
     * @param workDir directory inside the repository
     * @param message description stored with the stash entry
     * @return the commit id of the checkpoint, or empty when none could be taken
     */
    public Optional<String> createCheckpoint(Path workDir, String message) {
        try {
            GitOutput inside = runGit(workDir, "rev-parse", "--is-inside-work-tree");
            if (!inside.ok() || !"true".equals(inside.output().trim())) {
                log.info("{} is not inside a git work tree, skipping checkpoint", workDir);
                return Optional.empty();
            }

            GitOutput stash = runGit(workDir, "stash", "create", message);
            String stashId = stash.output().trim();
            if (stash.ok() && !stashId.isEmpty()) {
                GitOutput stored = runGit(workDir, "stash", "store", "-m", message, stashId);
                if (!stored.ok()) {
                    log.warn("git stash store exited with code {}: {}", stored.exitCode(), stored.output());
                }
                log.info("Created git checkpoint {} ({})", abbreviate(stashId), message);
                return Optional.of(stashId);
            }

            GitOutput head = runGit(workDir, "rev-parse", "HEAD");
            if (head.ok() && !head.output().isBlank()) {
                String headId = head.output().trim();
                log.info("Working tree clean, checkpoint is HEAD {}", abbreviate(headId));
                return Optional.of(headId);
            }
            log.warn("Could not resolve HEAD for checkpoint: {}", head.output());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("git unavailable, skipping checkpoint: {}", e.getMessage());
            return Optional.empty();
        }
    }

    GitOutput runGit(Path workDir, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        var process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();

        String output;
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            output = reader.lines().collect(Collectors.joining("\n"));
        }
        try {
            return new GitOutput(process.waitFor(), output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running git " + args[0], e);
        }
    }

    private static String abbreviate(String id) {
        return id.length() > 12 ? id.substring(0, 12) : id;
    }
}
