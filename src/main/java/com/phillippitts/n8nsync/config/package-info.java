/**
 * Application-wide configuration beans and properties.
 *
 * <ul>
 *   <li>{@link com.phillippitts.n8nsync.config.SyncConfig} - wires the reconciliation core
 *       for the instance-scoped workflow directory</li>
 *   <li>{@link com.phillippitts.n8nsync.config.ThreadPoolConfig} - sync and event executors,
 *       watcher scheduler</li>
 * </ul>
 *
 * <p>Sub-packages: {@code config.properties} ({@code n8n.api.*}, {@code n8n.sync.*},
 * {@code threadpool.*}) and {@code config.logging} (MDC filter).
 */
package com.phillippitts.n8nsync.config;
