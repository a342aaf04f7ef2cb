package com.phillippitts.n8nsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.n8nsync.config.properties.N8nApiProperties;
import com.phillippitts.n8nsync.config.properties.SyncProperties;
import com.phillippitts.n8nsync.service.archive.WorkflowArchive;
import com.phillippitts.n8nsync.service.engine.SyncEngine;
import com.phillippitts.n8nsync.service.events.ApplicationEventSyncListener;
import com.phillippitts.n8nsync.service.hash.CanonicalHasher;
import com.phillippitts.n8nsync.service.metrics.SyncMetrics;
import com.phillippitts.n8nsync.service.normalize.WorkflowNormalizer;
import com.phillippitts.n8nsync.service.orchestration.AutoSyncListener;
import com.phillippitts.n8nsync.service.orchestration.SyncManager;
import com.phillippitts.n8nsync.service.remote.N8nApiClient;
import com.phillippitts.n8nsync.service.remote.RestN8nApiClient;
import com.phillippitts.n8nsync.service.state.StateStore;
import com.phillippitts.n8nsync.service.watch.SyncEventListener;
import com.phillippitts.n8nsync.service.watch.SyncGuard;
import com.phillippitts.n8nsync.service.watch.WorkflowFiles;
import com.phillippitts.n8nsync.service.watch.WorkflowWatcher;
import com.phillippitts.n8nsync.util.InstanceIdentifiers;
import com.phillippitts.n8nsync.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

/**
 * Wires the reconciliation core. The core classes are plain objects; this class decides
 * which directory, client and listeners they share.
 */
@Configuration
public class SyncConfig {

    private static final Logger LOG = LogManager.getLogger(SyncConfig.class);

    private final SyncProperties syncProperties;
    private final N8nApiProperties apiProperties;

    // Pretty-printing mapper for workflow, archive and state files
    private final ObjectMapper fileMapper = Jsons.newMapper();

    public SyncConfig(SyncProperties syncProperties, N8nApiProperties apiProperties) {
        this.syncProperties = syncProperties;
        this.apiProperties = apiProperties;
    }

    /**
     * {@code <n8n.sync.directory>/<instance>}, where the instance identifier falls back to a
     * slug of the host plus a short API key fingerprint.
     */
    @Bean
    public Path workflowDirectory() {
        String identifier = syncProperties.getInstanceIdentifier();
        if (identifier == null || identifier.isBlank()) {
            identifier = InstanceIdentifiers.fallbackIdentifier(apiProperties.getHost(), apiProperties.getApiKey());
        }
        Path directory = Path.of(syncProperties.getDirectory()).resolve(identifier).toAbsolutePath().normalize();
        LOG.info("Workflow directory: {}", directory);
        return directory;
    }

    @Bean
    public WorkflowFiles workflowFiles(Path workflowDirectory) {
        return new WorkflowFiles(workflowDirectory, fileMapper);
    }

    @Bean
    public StateStore stateStore(Path workflowDirectory) {
        return new StateStore(workflowDirectory, fileMapper);
    }

    @Bean
    public WorkflowArchive workflowArchive(Path workflowDirectory) {
        return new WorkflowArchive(workflowDirectory, fileMapper);
    }

    @Bean
    public WorkflowNormalizer workflowNormalizer() {
        return new WorkflowNormalizer();
    }

    @Bean
    public CanonicalHasher canonicalHasher() {
        return new CanonicalHasher(fileMapper);
    }

    @Bean
    public SyncGuard syncGuard() {
        return new SyncGuard();
    }

    @Bean
    public N8nApiClient n8nApiClient(RestClient.Builder restClientBuilder) {
        return RestN8nApiClient.create(restClientBuilder, apiProperties);
    }

    @Bean
    public ApplicationEventSyncListener applicationEventSyncListener(ApplicationEventPublisher publisher) {
        return new ApplicationEventSyncListener(publisher);
    }

    @Bean
    public WorkflowWatcher workflowWatcher(WorkflowFiles files,
                                           StateStore stateStore,
                                           N8nApiClient client,
                                           WorkflowNormalizer normalizer,
                                           CanonicalHasher hasher,
                                           WorkflowArchive archive,
                                           SyncGuard guard,
                                           TaskScheduler taskScheduler,
                                           ObjectProvider<SyncEventListener> listeners) {
        return new WorkflowWatcher(files, stateStore, client, normalizer, hasher, archive, guard,
                syncProperties, taskScheduler, listeners.orderedStream().toList());
    }

    @Bean
    public SyncEngine syncEngine(N8nApiClient client,
                                 WorkflowWatcher watcher,
                                 WorkflowFiles files,
                                 WorkflowArchive archive,
                                 WorkflowNormalizer normalizer,
                                 SyncMetrics metrics) {
        return new SyncEngine(client, watcher, files, archive, normalizer, metrics);
    }

    @Bean
    public SyncManager syncManager(WorkflowWatcher watcher, SyncEngine engine) {
        return new SyncManager(watcher, engine);
    }

    /**
     * Automatic pull/push of non-conflicting changes.
     * Active only when {@code n8n.sync.auto-sync=true}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "n8n.sync", name = "auto-sync", havingValue = "true")
    public AutoSyncListener autoSyncListener(SyncEngine engine) {
        LOG.info("Auto-sync enabled: non-conflicting changes are pulled and pushed as observed");
        return new AutoSyncListener(engine);
    }
}
