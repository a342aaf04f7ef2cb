/**
 * Domain records shared by the watcher, the sync engine and the REST surface.
 *
 * <p>{@link com.phillippitts.n8nsync.domain.Workflow} is the single document type for both
 * sides of the reconciliation; {@link com.phillippitts.n8nsync.domain.WorkflowStatus} is the
 * computed snapshot broadcast to listeners.
 */
package com.phillippitts.n8nsync.domain;
