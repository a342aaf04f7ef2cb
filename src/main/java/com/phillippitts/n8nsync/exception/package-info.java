/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.n8nsync.exception.N8nSyncException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.n8nsync.exception.RemoteApiException} - Remote API call failed;
 *       carries the operation and HTTP status so callers can tell not-found from transient
 *       failures</li>
 *   <li>{@link com.phillippitts.n8nsync.exception.WorkflowFileException} - Local workflow file
 *       missing or malformed</li>
 *   <li>{@link com.phillippitts.n8nsync.exception.SyncStateException} - State file could not be
 *       persisted</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.n8nsync.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.n8nsync.exception;
