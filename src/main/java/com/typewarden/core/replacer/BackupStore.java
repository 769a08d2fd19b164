package com.typewarden.core.replacer;

import com.typewarden.core.config.CampaignProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Creates, restores and expires file backups.
 * <p>
 * Every backup is verified byte-for-byte against its source before it is
 * handed out, so an edit is never made on top of a partial copy.
 */
@Component
public class BackupStore {

    private static final Logger log = LoggerFactory.getLogger(BackupStore.class);

    static final String SUFFIX = ".backup";

    private final Path backupDirectory;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    @Autowired
    public BackupStore(CampaignProperties properties, Clock clock) {
        this(Path.of(properties.getReplacer().getBackupDirectory()), clock);
    }

    BackupStore(Path backupDirectory, Clock clock) {
        this.backupDirectory = backupDirectory;
        this.clock = clock;
    }

    /**
     * @throws ReplacementIoException if the copy cannot be written or does not match the source
     */
    public Backup createBackup(Path file) {
        Instant now = clock.instant();
        Path target = backupDirectory.resolve(
                file.getFileName() + "." + now.toEpochMilli() + "." + sequence.incrementAndGet() + SUFFIX);
        try {
            Files.createDirectories(backupDirectory);
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            if (Files.mismatch(file, target) != -1L) {
                throw new ReplacementIoException("Backup of " + file + " does not match its source");
            }
        } catch (IOException e) {
            log.error("Failed to back up {} to {}", file, target, e);
            throw new ReplacementIoException("Failed to back up " + file, e);
        }
        log.debug("Backed up {} to {}", file, target);
        return new Backup(file, target, now);
    }

    /**
     * Copies the backup over the original file and verifies the result.
     *
     * @throws ReplacementIoException if the restore fails
     */
    public void restore(Backup backup) {
        try {
            Files.copy(backup.backupFile(), backup.originalFile(), StandardCopyOption.REPLACE_EXISTING);
            if (Files.mismatch(backup.backupFile(), backup.originalFile()) != -1L) {
                throw new ReplacementIoException("Restored " + backup.originalFile() + " does not match its backup");
            }
        } catch (IOException e) {
            log.error("Failed to restore {} from {}", backup.originalFile(), backup.backupFile(), e);
            throw new ReplacementIoException("Failed to restore " + backup.originalFile(), e);
        }
        log.info("Restored {} from backup", backup.originalFile());
    }

    /**
     * Deletes backups whose modification time is older than {@code maxAge}.
     *
     * @return the number of backups deleted
     */
    public int deleteOlderThan(Duration maxAge) {
        if (!Files.isDirectory(backupDirectory)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int deleted = 0;
        for (Path backup : listBackups()) {
            try {
                if (Files.getLastModifiedTime(backup).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(backup);
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not expire backup {}: {}", backup, e.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Deleted {} backups older than {} days", deleted, maxAge.toDays());
        }
        return deleted;
    }

    public List<Path> listBackups() {
        if (!Files.isDirectory(backupDirectory)) {
            return List.of();
        }
        try (var stream = Files.list(backupDirectory)) {
            return stream.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new ReplacementIoException("Failed to list backups in " + backupDirectory, e);
        }
    }

    public Path getBackupDirectory() {
        return backupDirectory;
    }
}
