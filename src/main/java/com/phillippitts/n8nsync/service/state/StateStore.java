package com.phillippitts.n8nsync.service.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.n8nsync.exception.SyncStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Persists the last-synced hash of every workflow in {@code .n8n-state.json}.
 *
 * <p>File format:
 * <pre>
 * { "workflows": { "&lt;id&gt;": { "lastSyncedHash": "...", "lastSyncedAt": "2024-01-01T00:00:00Z" } } }
 * </pre>
 *
 * <p>The file is read once on first access and then kept in memory; every mutation rewrites
 * it through a temporary file and an atomic move. A missing or unreadable file yields an empty
 * state: nothing has a known base yet, which is safe.
 *
 * <p>Only the watcher writes through this store.
 */
public class StateStore {

    public static final String STATE_FILE_NAME = ".n8n-state.json";

    private static final Logger LOG = LogManager.getLogger(StateStore.class);

    private final Path stateFile;
    private final ObjectMapper mapper;

    // Guarded by this
    private Map<String, SyncState> workflows;

    public StateStore(Path directory, ObjectMapper mapper) {
        this.stateFile = directory.resolve(STATE_FILE_NAME);
        this.mapper = mapper;
    }

    public Path getStateFile() {
        return stateFile;
    }

    public synchronized Optional<SyncState> get(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(loaded().get(workflowId));
    }

    public Optional<String> lastSyncedHash(String workflowId) {
        return get(workflowId).map(SyncState::lastSyncedHash);
    }

    public synchronized Set<String> trackedIds() {
        return Set.copyOf(loaded().keySet());
    }

    public synchronized void put(String workflowId, String hash) {
        loaded().put(workflowId, new SyncState(hash, Instant.now()));
        save();
    }

    public synchronized void remove(String workflowId) {
        if (loaded().remove(workflowId) != null) {
            save();
        }
    }

    /**
     * Moves the entry of {@code oldId} to {@code newId}. No-op when {@code oldId} is untracked.
     */
    public synchronized void migrate(String oldId, String newId) {
        SyncState state = loaded().remove(oldId);
        if (state != null) {
            loaded().put(newId, state);
            save();
        }
    }

    private Map<String, SyncState> loaded() {
        if (workflows == null) {
            workflows = read();
        }
        return workflows;
    }

    private Map<String, SyncState> read() {
        if (!Files.exists(stateFile)) {
            return new TreeMap<>();
        }
        try {
            StateFile file = mapper.readValue(stateFile.toFile(), StateFile.class);
            if (file == null || file.workflows() == null) {
                return new TreeMap<>();
            }
            Map<String, SyncState> result = new TreeMap<>();
            file.workflows().forEach((id, state) -> {
                if (state != null && state.lastSyncedHash() != null) {
                    result.put(id, state);
                }
            });
            return result;
        } catch (IOException e) {
            LOG.warn("Could not read state file {}, starting with empty state: {}", stateFile, e.getMessage());
            return new TreeMap<>();
        }
    }

    private void save() {
        Path tmp = stateFile.resolveSibling(STATE_FILE_NAME + ".tmp");
        try {
            Files.createDirectories(stateFile.getParent());
            mapper.writeValue(tmp.toFile(), new StateFile(new TreeMap<>(workflows)));
            try {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SyncStateException(stateFile, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StateFile(Map<String, SyncState> workflows) {
    }
}
