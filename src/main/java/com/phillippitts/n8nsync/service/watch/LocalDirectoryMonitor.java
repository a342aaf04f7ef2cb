package com.phillippitts.n8nsync.service.watch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Watches the top level of the sync directory and reports settled file changes.
 *
 * <p>Each filename gets its own debounce timer: a burst of create/modify/delete events
 * produces one callback, {@code debounce} after the last event. The callback reports a change
 * when the file exists at that point and a deletion otherwise. Hidden names (the state file,
 * temporary files, {@code .archive}) and non-JSON files are ignored.
 */
public class LocalDirectoryMonitor implements AutoCloseable {

    /** Receives settled events. Called on scheduler threads. */
    public interface Listener {
        void onFileChanged(String filename);

        void onFileDeleted(String filename);

        /** Events were lost; the listener should rescan the directory. */
        void onOverflow();
    }

    private static final Logger LOG = LogManager.getLogger(LocalDirectoryMonitor.class);

    private final Path directory;
    private final Duration debounce;
    private final TaskScheduler scheduler;
    private final Listener listener;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    private WatchService watchService;
    private Thread pollThread;
    private volatile boolean running;

    public LocalDirectoryMonitor(Path directory, Duration debounce, TaskScheduler scheduler, Listener listener) {
        this.directory = directory;
        this.debounce = debounce;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        Files.createDirectories(directory);
        watchService = FileSystems.getDefault().newWatchService();
        directory.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);
        running = true;
        pollThread = new Thread(this::pollLoop, "workflow-dir-watch");
        pollThread.setDaemon(true);
        pollThread.start();
        LOG.info("Watching {} (debounce {} ms)", directory, debounce.toMillis());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
        try {
            watchService.close();
        } catch (IOException e) {
            LOG.warn("Failed to close watch service for {}: {}", directory, e.getMessage());
        }
        if (pollThread != null) {
            pollThread.interrupt();
        }
        LOG.info("Stopped watching {}", directory);
    }

    private void pollLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    LOG.warn("Filesystem events overflowed for {}, requesting rescan", directory);
                    scheduler.schedule(listener::onOverflow, Instant.now().plus(debounce));
                    continue;
                }
                Path changed = (Path) event.context();
                onRawEvent(changed.getFileName().toString());
            }
            if (!key.reset()) {
                LOG.warn("Watch key for {} is no longer valid; directory removed?", directory);
                running = false;
                return;
            }
        }
    }

    /**
     * Restarts the debounce timer for {@code filename}. Package-private so tests can drive
     * the debounce without a real watch service.
     */
    void onRawEvent(String filename) {
        if (!WorkflowFiles.isWorkflowFilename(filename)) {
            return;
        }
        pending.compute(filename, (name, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            return scheduler.schedule(() -> settle(name), Instant.now().plus(debounce));
        });
    }

    private void settle(String filename) {
        pending.remove(filename);
        try {
            if (Files.isRegularFile(directory.resolve(filename))) {
                listener.onFileChanged(filename);
            } else {
                listener.onFileDeleted(filename);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to process change of {}", filename, e);
        }
    }
}
