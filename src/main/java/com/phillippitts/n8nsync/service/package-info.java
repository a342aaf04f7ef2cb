/**
 * Reconciliation core and its supporting services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.hash} - canonical SHA-256 fingerprint of a workflow</li>
 *   <li>{@code service.normalize} - storage and push forms of a workflow</li>
 *   <li>{@code service.state} - persisted last-synced hash per workflow id</li>
 *   <li>{@code service.watch} - observation, status derivation, guards</li>
 *   <li>{@code service.engine} - pull/push/delete/restore operations</li>
 *   <li>{@code service.archive} - deletion safety net under {@code .archive/}</li>
 *   <li>{@code service.remote} - n8n REST API client</li>
 *   <li>{@code service.orchestration} - batch sweeps and auto-sync</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - logging,
 *       Micrometer meters and Actuator health</li>
 * </ul>
 *
 * <p>The core classes are plain constructor-injected objects wired in
 * {@link com.phillippitts.n8nsync.config.SyncConfig}; only the ambient components
 * (metrics, health, event logging) are {@code @Component}s.
 */
package com.phillippitts.n8nsync.service;
