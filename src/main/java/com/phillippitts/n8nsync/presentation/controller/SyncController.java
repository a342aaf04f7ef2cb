package com.phillippitts.n8nsync.presentation.controller;

import com.phillippitts.n8nsync.domain.SyncResult;
import com.phillippitts.n8nsync.domain.WorkflowStatus;
import com.phillippitts.n8nsync.service.engine.SyncEngine;
import com.phillippitts.n8nsync.service.orchestration.SyncManager;
import com.phillippitts.n8nsync.service.orchestration.SyncReport;
import com.phillippitts.n8nsync.service.watch.WorkflowWatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Control surface for the sync service. Every mutating endpoint goes through the
 * {@link SyncEngine}, so the same status rules apply as for automatic sync.
 */
@RestController
@RequestMapping("/api/sync")
class SyncController {

    private static final Logger log = LogManager.getLogger(SyncController.class);

    private final WorkflowWatcher watcher;
    private final SyncEngine engine;
    private final SyncManager manager;
    private final Executor syncExecutor;

    SyncController(WorkflowWatcher watcher,
                   SyncEngine engine,
                   SyncManager manager,
                   @Qualifier("syncExecutor") Executor syncExecutor) {
        this.watcher = watcher;
        this.engine = engine;
        this.manager = manager;
        this.syncExecutor = syncExecutor;
    }

    @GetMapping("/status")
    List<WorkflowStatus> status() {
        return watcher.getStatusMatrix();
    }

    @PostMapping("/refresh")
    List<WorkflowStatus> refresh() {
        log.info("Manual refresh requested");
        watcher.initialize();
        return watcher.getStatusMatrix();
    }

    @PostMapping("/pull")
    CompletableFuture<SyncReport> pullAll() {
        return CompletableFuture.supplyAsync(manager::pullAll, syncExecutor);
    }

    @PostMapping("/push")
    CompletableFuture<SyncReport> pushAll() {
        return CompletableFuture.supplyAsync(manager::pushAll, syncExecutor);
    }

    @PostMapping("/full")
    CompletableFuture<SyncReport> syncAll() {
        return CompletableFuture.supplyAsync(manager::syncAll, syncExecutor);
    }

    @PostMapping("/workflows/{id}/pull")
    SyncResult pull(@PathVariable("id") String id) {
        return engine.pull(id);
    }

    @PostMapping("/workflows/{id}/push")
    SyncResult push(@PathVariable("id") String id) {
        return engine.push(id);
    }

    @PostMapping("/workflows/{id}/force-pull")
    SyncResult forcePull(@PathVariable("id") String id) {
        return engine.forcePull(id);
    }

    @PostMapping("/workflows/{id}/force-push")
    SyncResult forcePush(@PathVariable("id") String id) {
        return engine.forcePush(id);
    }

    @PostMapping("/workflows/{id}/activate")
    SyncResult activate(@PathVariable("id") String id) {
        return engine.setActive(id, true);
    }

    @PostMapping("/workflows/{id}/deactivate")
    SyncResult deactivate(@PathVariable("id") String id) {
        return engine.setActive(id, false);
    }

    @PostMapping("/local/{filename}/push")
    SyncResult pushFile(@PathVariable("filename") String filename) {
        return engine.pushFile(filename);
    }

    /**
     * Deletes the workflow remotely, archives the local copy and confirms the deletion.
     */
    @DeleteMapping("/workflows/{id}")
    SyncResult delete(@PathVariable("id") String id) {
        SyncResult result = engine.deleteRemote(id);
        engine.confirmDeletion(id);
        return result;
    }

    @PostMapping("/archive/{filename}/restore")
    ResponseEntity<Map<String, Object>> restore(@PathVariable("filename") String filename) {
        boolean restored = engine.restoreFromArchive(filename);
        return ResponseEntity
                .status(restored ? HttpStatus.OK : HttpStatus.NOT_FOUND)
                .body(Map.of("filename", filename, "restored", restored));
    }
}
