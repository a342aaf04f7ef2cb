package com.phillippitts.n8nsync.service.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.exception.WorkflowFileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Deletion safety net: timestamped copies of workflows under {@code .archive/}.
 *
 * <p>Entries are named {@code <epochMillis>_<filename>}. Restoring an entry removes it,
 * so the archive only holds workflows that are currently deleted.
 */
public class WorkflowArchive {

    public static final String ARCHIVE_DIR_NAME = ".archive";

    private static final Logger LOG = LogManager.getLogger(WorkflowArchive.class);

    private final Path workingDirectory;
    private final Path archiveDirectory;
    private final ObjectMapper mapper;

    public WorkflowArchive(Path workingDirectory, ObjectMapper mapper) {
        this.workingDirectory = workingDirectory;
        this.archiveDirectory = workingDirectory.resolve(ARCHIVE_DIR_NAME);
        this.mapper = mapper;
    }

    public Path directory() {
        return archiveDirectory;
    }

    /**
     * Writes {@code content} as a new archive entry for {@code filename}.
     *
     * @return path of the archive entry
     */
    public Path snapshot(String filename, Workflow content) {
        Path target = nextEntry(filename);
        try {
            mapper.writeValue(target.toFile(), content);
        } catch (IOException e) {
            throw new WorkflowFileException(target, "Failed to write archive entry", e);
        }
        LOG.info("Archived snapshot of {} to {}", filename, target.getFileName());
        return target;
    }

    /**
     * Moves the working copy of {@code filename} into the archive.
     *
     * @return the archive entry, or empty when there was no working copy
     */
    public Optional<Path> moveToArchive(String filename) {
        Path source = workingDirectory.resolve(filename);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        Path target = nextEntry(filename);
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new WorkflowFileException(source, "Failed to move workflow into archive", e);
        }
        LOG.info("Moved {} into archive as {}", filename, target.getFileName());
        return Optional.of(target);
    }

    public boolean hasEntryFor(String filename) {
        return latestFor(filename).isPresent();
    }

    /** Most recent archive entry for {@code filename}. */
    public Optional<Path> latestFor(String filename) {
        return entriesFor(filename).stream()
                .max(Comparator.comparingLong(WorkflowArchive::timestampOf));
    }

    public List<Path> entriesFor(String filename) {
        if (!Files.isDirectory(archiveDirectory)) {
            return List.of();
        }
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(archiveDirectory)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                int sep = name.indexOf('_');
                if (sep > 0 && name.substring(sep + 1).equals(filename) && timestampOf(p) >= 0) {
                    entries.add(p);
                }
            }
        } catch (IOException e) {
            throw new WorkflowFileException(archiveDirectory, "Failed to list archive", e);
        }
        return entries;
    }

    /**
     * Copies the most recent archive entry for {@code filename} back into the working
     * directory and deletes the entry. A working copy already present is moved into the
     * archive first, so it stays restorable.
     *
     * @return false when no entry exists
     */
    public boolean restore(String filename) {
        Optional<Path> latest = latestFor(filename);
        if (latest.isEmpty()) {
            return false;
        }
        Path entry = latest.get();
        Path target = workingDirectory.resolve(filename);
        moveToArchive(filename).ifPresent(displaced ->
                LOG.warn("Working copy of {} archived as {} before restore", filename, displaced.getFileName()));
        try {
            Files.copy(entry, target);
            Files.delete(entry);
        } catch (IOException e) {
            throw new WorkflowFileException(entry, "Failed to restore archive entry", e);
        }
        LOG.info("Restored {} from archive entry {}", filename, entry.getFileName());
        return true;
    }

    private Path nextEntry(String filename) {
        try {
            Files.createDirectories(archiveDirectory);
        } catch (IOException e) {
            throw new WorkflowFileException(archiveDirectory, "Failed to create archive directory", e);
        }
        long ts = System.currentTimeMillis();
        Path candidate = archiveDirectory.resolve(ts + "_" + filename);
        // Two archives of the same file within one millisecond keep distinct, ordered names
        while (Files.exists(candidate)) {
            ts++;
            candidate = archiveDirectory.resolve(ts + "_" + filename);
        }
        return candidate;
    }

    private static long timestampOf(Path entry) {
        String name = entry.getFileName().toString();
        int sep = name.indexOf('_');
        if (sep <= 0) {
            return -1;
        }
        try {
            return Long.parseLong(name.substring(0, sep));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
