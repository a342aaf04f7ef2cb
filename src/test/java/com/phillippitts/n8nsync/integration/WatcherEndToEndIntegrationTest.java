package com.phillippitts.n8nsync.integration;

import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowSyncStatus;
import com.phillippitts.n8nsync.testutil.SyncHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static com.phillippitts.n8nsync.testutil.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Runs the watcher with real timers: filesystem events, debounce and remote polling.
 */
@Tag("integration")
class WatcherEndToEndIntegrationTest {

    @TempDir
    Path dir;

    private ThreadPoolTaskScheduler scheduler;
    private SyncHarness h;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("test-timer-");
        scheduler.initialize();
        h = new SyncHarness(dir, scheduler);
        h.properties.setDebounceMs(50);
        h.properties.setPollIntervalMs(100);
    }

    @AfterEach
    void tearDown() {
        h.watcher.stop();
        scheduler.shutdown();
    }

    @Test
    void observesLocalFilesAndRemoteEditsUntilInSync() throws Exception {
        Workflow seeded = h.remote.seed(workflow("Orders", "v0"));
        h.watcher.start();
        assertThat(h.watcher.isRunning()).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() ->
                h.events.statusesOf("Orders.json").contains(WorkflowSyncStatus.EXIST_ONLY_REMOTELY));

        h.engine.pull(seeded.id());
        assertThat(h.watcher.statusFor(seeded.id()).status()).isEqualTo(WorkflowSyncStatus.IN_SYNC);

        h.remote.edit(seeded.id(), w -> workflow(seeded.id(), "Orders", "v1"));
        await().atMost(Duration.ofSeconds(5)).until(() ->
                h.watcher.statusFor(seeded.id()).status() == WorkflowSyncStatus.MODIFIED_REMOTELY);

        h.engine.pull(seeded.id());
        h.writeLocal("Draft.json", workflow("Draft", "x"));
        await().atMost(Duration.ofSeconds(15)).until(() ->
                h.events.statusesOf("Draft.json").contains(WorkflowSyncStatus.EXIST_ONLY_LOCALLY));

        Files.delete(dir.resolve("Draft.json"));
        await().atMost(Duration.ofSeconds(15)).until(() ->
                h.watcher.statusForFile("Draft.json").localHash() == null);
    }

    @Test
    void engineWritesDoNotSurfaceAsLocalChanges() throws Exception {
        Workflow seeded = h.remote.seed(workflow("Orders", "v0"));
        h.watcher.start();
        await().atMost(Duration.ofSeconds(5)).until(h.watcher::isRemoteStateKnown);

        h.engine.pull(seeded.id());
        Thread.sleep(500);

        assertThat(h.events.statusesOf("Orders.json")).doesNotContain(
                WorkflowSyncStatus.MODIFIED_LOCALLY, WorkflowSyncStatus.CONFLICT);
        assertThat(h.watcher.statusFor(seeded.id()).status()).isEqualTo(WorkflowSyncStatus.IN_SYNC);
    }

    @Test
    void stopCancelsPolling() throws Exception {
        h.watcher.start();
        h.watcher.stop();
        int calls = h.remote.listCalls.get();

        Thread.sleep(400);

        assertThat(h.watcher.isRunning()).isFalse();
        assertThat(h.remote.listCalls.get()).isEqualTo(calls);
    }
}
