package com.typewarden.core.replacer;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A verbatim pre-edit copy of one file.
 *
 * @param originalFile the file that was copied
 * @param backupFile   where the copy lives, outside the working tree
 * @param createdAt    when the copy was taken
 */
public record Backup(
    Path originalFile,
    Path backupFile,
    Instant createdAt
) {}
