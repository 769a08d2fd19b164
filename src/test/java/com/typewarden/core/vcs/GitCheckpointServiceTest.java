package com.typewarden.core.vcs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GitCheckpointServiceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("a directory outside any repository gets no checkpoint")
    void notARepository() {
        assertTrue(new GitCheckpointService().createCheckpoint(tempDir, "checkpoint").isEmpty());
    }

    @Test
    @DisplayName("a missing git executable gets no checkpoint")
    void missingGit() {
        var service = new GitCheckpointService(tempDir.resolve("no-such-git").toString());

        assertTrue(service.createCheckpoint(tempDir, "checkpoint").isEmpty());
    }
}
