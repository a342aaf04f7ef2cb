package com.phillippitts.n8nsync.service.watch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.exception.WorkflowFileException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads and writes workflow files in the sync directory.
 *
 * <p>Writes go through a hidden temporary file and an atomic rename, so the directory
 * monitor never observes a half-written workflow.
 */
public class WorkflowFiles {

    public static final String SUFFIX = ".json";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[/\\\\:]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Path directory;
    private final ObjectMapper mapper;

    public WorkflowFiles(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    /**
     * Derives the local filename for a workflow name: path separators and colons become
     * {@code _}, whitespace runs collapse to one space, the result is trimmed and
     * {@code .json} is appended.
     */
    public static String filenameFor(String workflowName) {
        String name = workflowName == null ? "" : workflowName;
        String safe = UNSAFE_CHARS.matcher(name).replaceAll("_");
        safe = WHITESPACE.matcher(safe).replaceAll(" ").trim();
        return safe + SUFFIX;
    }

    /** Filename without the {@code .json} suffix. */
    public static String stem(String filename) {
        return filename.endsWith(SUFFIX) ? filename.substring(0, filename.length() - SUFFIX.length()) : filename;
    }

    /** True for visible {@code *.json} names, the only files the sync directory tracks. */
    public static boolean isWorkflowFilename(String filename) {
        return filename != null && filename.endsWith(SUFFIX) && !filename.startsWith(".");
    }

    public Path directory() {
        return directory;
    }

    public Path resolve(String filename) {
        return directory.resolve(filename);
    }

    public boolean exists(String filename) {
        return Files.isRegularFile(resolve(filename));
    }

    /**
     * Lists tracked workflow filenames in sorted order. Returns an empty list when the
     * directory does not exist.
     */
    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (isWorkflowFilename(name) && Files.isRegularFile(p)) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            throw new WorkflowFileException(directory, "Failed to list workflow directory", e);
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Parses a workflow file.
     *
     * @throws WorkflowFileException when the file is missing or not a JSON object
     */
    public Workflow read(String filename) {
        Path path = resolve(filename);
        if (!Files.isRegularFile(path)) {
            throw new WorkflowFileException(path, "Workflow file not found");
        }
        try {
            Workflow workflow = mapper.readValue(path.toFile(), Workflow.class);
            if (workflow == null) {
                throw new WorkflowFileException(path, "Workflow file is empty");
            }
            return workflow;
        } catch (IOException e) {
            throw new WorkflowFileException(path, "Malformed workflow file", e);
        }
    }

    public void write(String filename, Workflow workflow) {
        Path target = resolve(filename);
        Path tmp = directory.resolve("." + filename + ".tmp");
        try {
            Files.createDirectories(directory);
            mapper.writeValue(tmp.toFile(), workflow);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new WorkflowFileException(target, "Failed to write workflow file", e);
        }
    }
}
